package com.zaka.marketplace.domain.product.event;

/**
 * 재고 부족 감지 이벤트
 * 재고 변경 트랜잭션이 커밋된 이후에만 처리됨
 */
public record LowStockDetectedEvent(
        String productId,
        String vendorId,
        String productName,
        int remainingQuantity
) {
}
