package com.zaka.marketplace.domain.product.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 재고 부족 판단 기준
 * 0 < 남은 수량 <= threshold 인 경우 재고 부족으로 판단 (품절은 제외)
 */
@Component
public class LowStockPolicy {

    private final int threshold;

    public LowStockPolicy(@Value("${marketplace.inventory.low-stock-threshold:5}") int threshold) {
        this.threshold = threshold;
    }

    public boolean isLow(int remainingQuantity) {
        return remainingQuantity > 0 && remainingQuantity <= threshold;
    }
}
