package com.zaka.marketplace.application.order.service;

import com.zaka.marketplace.application.order.dto.OrderEventPayload;
import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.entity.OrderItem;
import com.zaka.marketplace.domain.order.exception.OrderNotFoundException;
import com.zaka.marketplace.domain.order.repository.OrderItemRepository;
import com.zaka.marketplace.domain.order.repository.OrderRepository;
import com.zaka.marketplace.infrastructure.outbox.OutboxEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 주문 취소 서비스
 *
 * 주문 행 락 → 상태 CANCELLED 전이 → 재고 복원 순서로 처리
 * 이미 취소된 주문을 다시 취소해도 재고는 한 번만 복원됨
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CancelOrderService {

    static final String ORDER_CANCELLED = "ORDER_CANCELLED";

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final InventoryRestorationService inventoryRestorationService;
    private final OutboxEventRecorder outboxEventRecorder;

    @Transactional
    public OrderResponse cancel(String orderId) {
        Order order = orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        List<OrderItem> orderItems = orderItemRepository.findByOrderId(orderId);

        if (order.cancel()) {
            outboxEventRecorder.record(PlaceOrderService.AGGREGATE_TYPE, orderId, ORDER_CANCELLED,
                    OrderEventPayload.of(order, orderItems));
            log.info("[ORDER] 주문 취소 - orderNumber={}, orderId={}", order.getOrderNumber(), orderId);
        }

        InventoryRestorationService.RestorationResult result = inventoryRestorationService.restoreInventory(orderId);
        if (result.restored()) {
            log.info("[ORDER] 취소 주문 재고 복원 완료 - orderId={}, units={}", orderId, result.totalRestoredUnits());
        }

        return OrderResponse.from(order, orderItems);
    }
}
