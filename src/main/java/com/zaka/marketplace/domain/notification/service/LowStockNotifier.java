package com.zaka.marketplace.domain.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaka.marketplace.domain.notification.NotificationType;
import com.zaka.marketplace.domain.notification.entity.Notification;
import com.zaka.marketplace.domain.notification.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 재고 부족 알림 생성 서비스
 *
 * 주문 트랜잭션과 분리된 별도 트랜잭션에서 알림을 저장
 * 실패 처리는 호출자(이벤트 리스너)가 담당
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LowStockNotifier {

    private static final String TITLE = "재고 부족";

    private final NotificationRepository notificationRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notifyLowStock(String vendorUserId, String productName, int remainingQuantity) {
        Notification notification = Notification.builder()
                .userId(vendorUserId)
                .type(NotificationType.LOW_STOCK)
                .title(TITLE)
                .message(String.format("상품 \"%s\"의 재고가 %d개 남았습니다.", productName, remainingQuantity))
                .data(toJson(new LowStockPayload(productName, remainingQuantity)))
                .build();

        notificationRepository.save(notification);

        log.info("[INVENTORY] 재고 부족 알림 생성 - userId={}, product={}, remaining={}",
                vendorUserId, productName, remainingQuantity);
    }

    private String toJson(LowStockPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("재고 부족 알림 payload 직렬화 실패", e);
        }
    }

    /**
     * 재고 부족 알림 payload
     */
    public record LowStockPayload(String productName, int stockQuantity) {
    }
}
