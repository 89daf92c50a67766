package com.zaka.marketplace.domain.order.service;

import java.math.BigDecimal;

/**
 * 수수료 분배 결과 (모두 scale 2)
 *
 * @param rate             적용된 수수료율 (퍼센트)
 * @param commissionAmount 수수료 금액
 * @param vendorEarnings   판매자 정산 금액 (subtotal - commissionAmount)
 * @param platformRevenue  플랫폼 수익 (= commissionAmount)
 */
public record CommissionSplit(
        BigDecimal rate,
        BigDecimal commissionAmount,
        BigDecimal vendorEarnings,
        BigDecimal platformRevenue
) {
}
