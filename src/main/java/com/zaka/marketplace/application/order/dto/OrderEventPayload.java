package com.zaka.marketplace.application.order.dto;

import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.entity.OrderItem;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outbox 에 저장되는 주문 이벤트 payload
 */
public record OrderEventPayload(
        String orderId,
        String orderNumber,
        String customerId,
        String vendorId,
        String status,
        BigDecimal subtotal,
        BigDecimal totalAmount,
        BigDecimal commissionAmount,
        BigDecimal vendorEarnings,
        List<Line> items
) {

    public static OrderEventPayload of(Order order, List<OrderItem> orderItems) {
        return new OrderEventPayload(
                order.getOrderId(),
                order.getOrderNumber(),
                order.getCustomerId(),
                order.getVendorId(),
                order.getStatus().name(),
                order.getSubtotal(),
                order.getTotalAmount(),
                order.getCommissionAmount(),
                order.getVendorEarnings(),
                orderItems.stream()
                        .map(item -> new Line(item.getProductId(), item.getQuantity()))
                        .toList()
        );
    }

    public record Line(String productId, int quantity) {
    }
}
