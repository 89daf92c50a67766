package com.zaka.marketplace.application.order.dto;

import com.zaka.marketplace.domain.order.entity.OrderItem;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

public record OrderItemResponse(
        @Schema(description = "주문 항목 ID")
        String orderItemId,
        @Schema(description = "상품 ID")
        String productId,
        @Schema(description = "상품명 (주문 시점)")
        String productName,
        @Schema(description = "수량", example = "3")
        int quantity,
        @Schema(description = "단가 (주문 시점)", example = "1000.00")
        BigDecimal unitPrice
) {
    public static OrderItemResponse from(OrderItem orderItem) {
        return new OrderItemResponse(
                orderItem.getOrderItemId(),
                orderItem.getProductId(),
                orderItem.getProductName(),
                orderItem.getQuantity(),
                orderItem.getUnitPrice()
        );
    }
}
