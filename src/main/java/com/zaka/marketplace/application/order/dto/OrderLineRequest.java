package com.zaka.marketplace.application.order.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record OrderLineRequest(
        @Schema(description = "상품 ID", example = "7f1c2a9e-5b7e-4c61-9f0e-2f4f3a6d1b20")
        @NotBlank(message = "상품 ID는 필수입니다")
        String productId,

        @Schema(description = "주문 수량 (기본값 1)", example = "3")
        @Positive(message = "주문 수량은 1 이상이어야 합니다")
        Integer quantity
) {
}
