package com.zaka.marketplace.domain.product.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 재고가 부족할 때 발생하는 예외
 * 고객이 수량을 조정할 수 있도록 상품명, 현재 재고, 요청 수량을 함께 전달
 */
public class InsufficientStockException extends BusinessException {

    private final String productName;
    private final int available;
    private final int requested;

    public InsufficientStockException(String productName, int available, int requested) {
        super(ErrorCode.P002,
                String.format("재고가 부족합니다: %s (요청: %d, 재고: %d)", productName, requested, available));
        this.productName = productName;
        this.available = available;
        this.requested = requested;
    }

    public String getProductName() {
        return productName;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }
}
