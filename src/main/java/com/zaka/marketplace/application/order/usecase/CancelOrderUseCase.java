package com.zaka.marketplace.application.order.usecase;

import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.application.order.service.CancelOrderService;
import com.zaka.marketplace.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 주문 취소 유스케이스
 * 취소 시 재고 복원(보상 트랜잭션)이 함께 실행됨
 */
@Service
@RequiredArgsConstructor
public class CancelOrderUseCase {

    private final CancelOrderService cancelOrderService;

    @DistributedLock(key = "'order:cancel:' + #orderId")
    public OrderResponse execute(String orderId) {
        return cancelOrderService.cancel(orderId);
    }
}
