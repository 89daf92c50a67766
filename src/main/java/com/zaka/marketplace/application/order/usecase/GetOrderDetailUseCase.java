package com.zaka.marketplace.application.order.usecase;

import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.exception.OrderNotFoundException;
import com.zaka.marketplace.domain.order.repository.OrderItemRepository;
import com.zaka.marketplace.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 상세 조회 유스케이스
 */
@Service
@RequiredArgsConstructor
public class GetOrderDetailUseCase {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    @Transactional(readOnly = true)
    public OrderResponse execute(String orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        return OrderResponse.from(order, orderItemRepository.findByOrderId(orderId));
    }
}
