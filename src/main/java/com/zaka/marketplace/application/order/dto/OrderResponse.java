package com.zaka.marketplace.application.order.dto;

import com.zaka.marketplace.domain.order.OrderStatus;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.entity.OrderItem;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
        @Schema(description = "주문 ID")
        String orderId,
        @Schema(description = "주문 번호", example = "ZK-2026-7KQ2M9XH4D")
        String orderNumber,
        @Schema(description = "고객 ID")
        String customerId,
        @Schema(description = "판매자 ID")
        String vendorId,
        @Schema(description = "주문 상태", example = "PENDING")
        OrderStatus status,
        @Schema(description = "상품 금액 합계", example = "3000.00")
        BigDecimal subtotal,
        @Schema(description = "배송비", example = "500.00")
        BigDecimal deliveryFee,
        @Schema(description = "세금", example = "0.00")
        BigDecimal taxAmount,
        @Schema(description = "총 금액", example = "3500.00")
        BigDecimal totalAmount,
        @Schema(description = "수수료율 (%)", example = "5.00")
        BigDecimal commissionRate,
        @Schema(description = "수수료", example = "150.00")
        BigDecimal commissionAmount,
        @Schema(description = "판매자 정산 금액", example = "2850.00")
        BigDecimal vendorEarnings,
        @Schema(description = "플랫폼 수익", example = "150.00")
        BigDecimal platformRevenue,
        @Schema(description = "통화", example = "CFA")
        String currency,
        @Schema(description = "주문 항목 목록")
        List<OrderItemResponse> items,
        @Schema(description = "주문 생성 일시")
        LocalDateTime createdAt,
        @Schema(description = "주문 취소 일시")
        LocalDateTime cancelledAt
) {
    public static OrderResponse from(Order order, List<OrderItem> orderItems) {
        List<OrderItemResponse> itemResponses = orderItems.stream()
                .map(OrderItemResponse::from)
                .toList();

        return new OrderResponse(
                order.getOrderId(),
                order.getOrderNumber(),
                order.getCustomerId(),
                order.getVendorId(),
                order.getStatus(),
                order.getSubtotal(),
                order.getDeliveryFee(),
                order.getTaxAmount(),
                order.getTotalAmount(),
                order.getCommissionRate(),
                order.getCommissionAmount(),
                order.getVendorEarnings(),
                order.getPlatformRevenue(),
                order.getCurrency(),
                itemResponses,
                order.getCreatedAt(),
                order.getCancelledAt()
        );
    }
}
