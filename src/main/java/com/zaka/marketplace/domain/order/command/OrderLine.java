package com.zaka.marketplace.domain.order.command;

/**
 * 주문 항목 요청
 */
public record OrderLine(String productId, int quantity) {

    public static final int DEFAULT_QUANTITY = 1;

    public static OrderLine of(String productId, Integer quantity) {
        return new OrderLine(productId, quantity == null ? DEFAULT_QUANTITY : quantity);
    }
}
