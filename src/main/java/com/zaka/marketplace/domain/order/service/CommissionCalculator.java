package com.zaka.marketplace.domain.order.service;

import com.zaka.marketplace.common.money.Money;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * 수수료 계산기
 *
 * 수수료는 상품 금액(subtotal)에만 부과하며 배송비와 세금은 제외함
 * 계산 결과는 주문 생성 시점에 주문 행에 고정 저장되고 다시 계산하지 않음
 */
@Component
public class CommissionCalculator {

    private final BigDecimal defaultRatePercent;

    public CommissionCalculator(@Value("${marketplace.commission.default-rate:5.00}") BigDecimal defaultRatePercent) {
        this.defaultRatePercent = defaultRatePercent;
    }

    /**
     * 설정된 플랫폼 기본 수수료율을 사용하는 수수료 분배
     */
    public CommissionSplit computeSplit(BigDecimal subtotal, BigDecimal vendorCommissionRatePercent) {
        return computeSplit(subtotal, vendorCommissionRatePercent, defaultRatePercent);
    }

    /**
     * 수수료 분배 계산
     *
     * @param subtotal                    상품 금액 합계
     * @param vendorCommissionRatePercent 판매자 수수료율 (퍼센트, null 이면 기본값)
     * @param defaultRatePercent          기본 수수료율 (퍼센트)
     */
    public CommissionSplit computeSplit(BigDecimal subtotal,
                                        BigDecimal vendorCommissionRatePercent,
                                        BigDecimal defaultRatePercent) {
        BigDecimal rate = Money.toFixed(
                vendorCommissionRatePercent != null ? vendorCommissionRatePercent : defaultRatePercent);
        BigDecimal base = Money.toFixed(subtotal);

        BigDecimal commissionAmount = Money.roundMoney(Money.calculatePercentage(base, rate));
        BigDecimal vendorEarnings = base.subtract(commissionAmount);

        return new CommissionSplit(rate, commissionAmount, vendorEarnings, commissionAmount);
    }

    public BigDecimal getDefaultRatePercent() {
        return defaultRatePercent;
    }
}
