package com.zaka.marketplace.application.inventory.listener;

import com.zaka.marketplace.domain.notification.service.LowStockNotifier;
import com.zaka.marketplace.domain.product.event.LowStockDetectedEvent;
import com.zaka.marketplace.domain.vendor.entity.Vendor;
import com.zaka.marketplace.domain.vendor.repository.VendorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Optional;

/**
 * 재고 부족 이벤트 리스너
 *
 * 재고를 변경한 트랜잭션이 커밋된 이후에만 실행됨 (롤백 시 알림 없음)
 * 알림 생성 실패는 로그만 남기고 호출자에게 전파하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LowStockEventListener {

    private final VendorRepository vendorRepository;
    private final LowStockNotifier lowStockNotifier;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleLowStock(LowStockDetectedEvent event) {
        try {
            Optional<Vendor> vendor = vendorRepository.findById(event.vendorId());
            if (vendor.isEmpty()) {
                log.warn("[INVENTORY] 재고 부족 알림 대상 판매자 없음 - vendorId={}, productId={}",
                        event.vendorId(), event.productId());
                return;
            }
            lowStockNotifier.notifyLowStock(vendor.get().getUserId(), event.productName(), event.remainingQuantity());
        } catch (Exception e) {
            log.error("[INVENTORY] 재고 부족 알림 생성 실패 - productId={}, remaining={}",
                    event.productId(), event.remainingQuantity(), e);
        }
    }
}
