package com.zaka.marketplace.application.product.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record AdjustStockRequest(
        @Schema(description = "변경할 재고 수량", example = "20")
        @NotNull(message = "재고 수량은 필수입니다")
        @PositiveOrZero(message = "재고는 음수일 수 없습니다")
        Integer quantity,

        @Schema(description = "조정 사유", example = "입고")
        String reason
) {
}
