package com.zaka.marketplace.domain.product.vo;

import com.zaka.marketplace.domain.product.exception.InvalidStockQuantityException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * 재고 Value Object
 *
 * trackQuantity=false 인 상품은 항상 구매 가능하며 수량을 건드리지 않음
 * trackQuantity=true 인 상품의 수량은 음수가 될 수 없음
 */
@Embeddable
public record Stock(
        @Column(name = "quantity", nullable = false)
        int quantity,

        @Column(name = "track_quantity", nullable = false)
        boolean trackQuantity
) {

    public Stock {
        if (trackQuantity && quantity < 0) {
            throw new InvalidStockQuantityException(quantity);
        }
    }

    public static Stock tracked(int quantity) {
        return new Stock(quantity, true);
    }

    public static Stock untracked() {
        return new Stock(0, false);
    }

    /**
     * 요청 수량을 충족할 수 있는지 확인
     * 수량을 추적하지 않는 상품은 항상 true
     */
    public boolean canFulfill(int requestedQuantity) {
        return !trackQuantity || quantity >= requestedQuantity;
    }

    /**
     * 차감 후 남는 수량 (추적하지 않는 상품은 그대로)
     */
    public int remainingAfter(int requestedQuantity) {
        return trackQuantity ? quantity - requestedQuantity : quantity;
    }

    /**
     * 수동 재고 조정
     */
    public Stock adjustTo(int newQuantity) {
        return new Stock(newQuantity, trackQuantity);
    }
}
