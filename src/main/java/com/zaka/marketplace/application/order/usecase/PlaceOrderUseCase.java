package com.zaka.marketplace.application.order.usecase;

import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.application.order.dto.PlaceOrderRequest;
import com.zaka.marketplace.application.order.service.PlaceOrderService;
import com.zaka.marketplace.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 주문 생성 유스케이스
 *
 * 동시성 제어 전략:
 * - 고객별 Redisson 분산 락 ("lock:order:customer:{customerId}")으로 같은 고객의 중복 제출 차단
 * - 재고 정합성은 분산 락이 아닌 DB 행 락(SELECT FOR UPDATE) + 조건부 UPDATE 로 보장
 *   → 서로 다른 고객이 같은 상품을 동시에 주문해도 재고가 음수가 되지 않음
 */
@Service
@RequiredArgsConstructor
public class PlaceOrderUseCase {

    private final PlaceOrderService placeOrderService;

    @DistributedLock(key = "'order:customer:' + #request.customerId")
    public OrderResponse execute(PlaceOrderRequest request) {
        return placeOrderService.placeOrder(request);
    }
}
