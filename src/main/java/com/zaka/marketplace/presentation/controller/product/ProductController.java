package com.zaka.marketplace.presentation.controller.product;

import com.zaka.marketplace.application.product.dto.AdjustStockRequest;
import com.zaka.marketplace.application.product.dto.ProductStockResponse;
import com.zaka.marketplace.application.product.usecase.AdjustProductStockUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 상품 재고 관리 API (판매자)
 */
@Tag(name = "상품 재고", description = "판매자 재고 조정 API")
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final AdjustProductStockUseCase adjustProductStockUseCase;

    /**
     * 재고 수동 조정
     * PATCH /api/products/{productId}/stock
     */
    @Operation(summary = "재고 조정", description = "상품 재고 수량을 지정한 값으로 변경합니다")
    @PatchMapping("/{productId}/stock")
    public ResponseEntity<ProductStockResponse> adjustStock(
            @Parameter(description = "상품 ID") @PathVariable String productId,
            @Valid @RequestBody AdjustStockRequest request) {

        return ResponseEntity.ok(adjustProductStockUseCase.execute(productId, request));
    }
}
