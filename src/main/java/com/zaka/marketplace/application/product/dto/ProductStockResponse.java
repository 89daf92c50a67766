package com.zaka.marketplace.application.product.dto;

import com.zaka.marketplace.domain.product.entity.Product;
import io.swagger.v3.oas.annotations.media.Schema;

public record ProductStockResponse(
        @Schema(description = "상품 ID")
        String productId,
        @Schema(description = "상품명")
        String name,
        @Schema(description = "재고 수량", example = "20")
        int quantity,
        @Schema(description = "재고 추적 여부", example = "true")
        boolean trackQuantity
) {
    public static ProductStockResponse from(Product product) {
        return new ProductStockResponse(
                product.getProductId(),
                product.getName(),
                product.getStock().quantity(),
                product.getStock().trackQuantity()
        );
    }
}
