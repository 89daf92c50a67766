package com.zaka.marketplace.application.order.dto;

import com.zaka.marketplace.domain.order.command.OrderDraft;
import com.zaka.marketplace.domain.order.command.OrderLine;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;

public record PlaceOrderRequest(
        @Schema(description = "고객 ID", example = "U001")
        @NotBlank(message = "고객 ID는 필수입니다")
        String customerId,

        @Schema(description = "판매자 ID", example = "V001")
        @NotBlank(message = "판매자 ID는 필수입니다")
        String vendorId,

        @Schema(description = "상품 금액 합계", example = "3000.00")
        @NotNull(message = "상품 금액은 필수입니다")
        @PositiveOrZero
        BigDecimal subtotal,

        @Schema(description = "배송비", example = "500.00")
        @PositiveOrZero
        BigDecimal deliveryFee,

        @Schema(description = "세금", example = "0.00")
        @PositiveOrZero
        BigDecimal taxAmount,

        @Schema(description = "총 금액 (생략 시 subtotal + deliveryFee + taxAmount)", example = "3500.00")
        @PositiveOrZero
        BigDecimal totalAmount,

        @Schema(description = "요청 사항")
        String notes,

        @Schema(description = "주문 항목")
        @NotEmpty(message = "주문 항목은 1개 이상이어야 합니다")
        List<@Valid OrderLineRequest> items
) {

    public OrderDraft toDraft() {
        return new OrderDraft(customerId, vendorId, subtotal, deliveryFee, taxAmount, totalAmount, notes);
    }

    public List<OrderLine> toLines() {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .map(item -> OrderLine.of(item.productId(), item.quantity()))
                .toList();
    }
}
