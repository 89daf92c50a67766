package com.zaka.marketplace.domain.order.command;

import java.math.BigDecimal;

/**
 * 주문 생성 요청 (검증 전 초안)
 * totalAmount 가 null 이면 subtotal + deliveryFee + taxAmount 로 계산
 */
public record OrderDraft(
        String customerId,
        String vendorId,
        BigDecimal subtotal,
        BigDecimal deliveryFee,
        BigDecimal taxAmount,
        BigDecimal totalAmount,
        String notes
) {
}
