package com.zaka.marketplace.application.order.service;

import com.zaka.marketplace.application.order.dto.OrderEventPayload;
import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.application.order.dto.PlaceOrderRequest;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.service.OrderPlacementFacade;
import com.zaka.marketplace.domain.order.service.OrderPlacementFacade.OrderPlacementResult;
import com.zaka.marketplace.domain.order.service.OrderPlacementFacade.StockReservation;
import com.zaka.marketplace.domain.product.event.LowStockDetectedEvent;
import com.zaka.marketplace.domain.product.service.LowStockPolicy;
import com.zaka.marketplace.infrastructure.outbox.OutboxEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 주문 생성 트랜잭션 처리 서비스
 *
 * 재고 확인/차감, 주문 및 주문 항목 저장, Outbox 이벤트 저장이 하나의 트랜잭션으로 처리됨
 * 하나라도 실패하면 주문, 주문 항목, 재고 변경이 모두 롤백됨
 *
 * 재고 부족 알림은 커밋 이후에만 처리되며 실패해도 주문 결과에 영향을 주지 않음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlaceOrderService {

    static final String AGGREGATE_TYPE = "ORDER";
    static final String ORDER_PLACED = "ORDER_PLACED";

    private final OrderPlacementFacade orderPlacementFacade;
    private final OutboxEventRecorder outboxEventRecorder;
    private final LowStockPolicy lowStockPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public OrderResponse placeOrder(PlaceOrderRequest request) {
        // 1. 주문 생성 (재고 락/검증/차감, 수수료 계산, 저장)
        OrderPlacementResult result = orderPlacementFacade.placeOrder(request.toDraft(), request.toLines());
        Order order = result.order();

        // 2. Outbox에 이벤트 저장 (같은 트랜잭션)
        outboxEventRecorder.record(AGGREGATE_TYPE, order.getOrderId(), ORDER_PLACED,
                OrderEventPayload.of(order, result.orderItems()));

        // 3. 재고 부족 이벤트 등록 (AFTER_COMMIT 리스너에서 처리)
        publishLowStockEvents(result.reservations());

        return OrderResponse.from(order, result.orderItems());
    }

    private void publishLowStockEvents(List<StockReservation> reservations) {
        reservations.stream()
                .filter(StockReservation::tracked)
                .filter(reservation -> lowStockPolicy.isLow(reservation.remainingQuantity()))
                .forEach(reservation -> eventPublisher.publishEvent(new LowStockDetectedEvent(
                        reservation.productId(),
                        reservation.vendorId(),
                        reservation.productName(),
                        reservation.remainingQuantity()
                )));
    }
}
