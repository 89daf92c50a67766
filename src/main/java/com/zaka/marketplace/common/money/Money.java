package com.zaka.marketplace.common.money;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * 금액 계산 유틸리티
 *
 * 모든 금액 계산은 이 클래스를 거쳐야 함 (double 연산 금지)
 * - 내부적으로 BigDecimal(유효숫자 20자리, HALF_UP) 사용
 * - 잘못된 입력은 예외 대신 0을 반환하고 로그를 남김
 * - 입력 검증이 필요한 호출자는 호출 전에 직접 검증해야 함
 */
@Slf4j
public final class Money {

    public static final MathContext CONTEXT = new MathContext(20, RoundingMode.HALF_UP);
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final int SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String DEFAULT_CURRENCY = "XOF";

    private Money() {
    }

    /**
     * 주 통화 단위를 최소 단위로 변환 (예: 1234.56 → 123456)
     */
    public static long toMinorUnit(Object amount) {
        if (isBlank(amount)) {
            return 0L;
        }
        BigDecimal decimal = toDecimal(amount);
        if (decimal == null) {
            log.error("최소 단위 변환 불가 금액: {}", amount);
            return 0L;
        }
        try {
            return decimal.multiply(HUNDRED, CONTEXT).setScale(0, ROUNDING).longValueExact();
        } catch (ArithmeticException e) {
            log.error("최소 단위 변환 중 오류: {}", amount, e);
            return 0L;
        }
    }

    /**
     * 최소 단위를 주 통화 단위로 변환 (예: 123456 → 1234.56)
     */
    public static BigDecimal toMajorUnit(Object minorAmount) {
        if (isBlank(minorAmount)) {
            return BigDecimal.ZERO;
        }
        BigDecimal decimal = toDecimal(minorAmount);
        if (decimal == null) {
            log.error("주 단위 변환 불가 금액: {}", minorAmount);
            return BigDecimal.ZERO;
        }
        return decimal.divide(HUNDRED, CONTEXT);
    }

    /**
     * 수수료 계산: amount * rate
     *
     * @param rate 분수 형태의 비율 (5%는 0.05). 퍼센트 값은 {@link #calculatePercentage} 사용
     */
    public static BigDecimal calculateCommission(Object amount, Object rate) {
        BigDecimal amountDecimal = toDecimal(amount);
        BigDecimal rateDecimal = toDecimal(rate);
        if (amountDecimal == null || rateDecimal == null) {
            log.error("수수료 계산 불가: amount={}, rate={}", amount, rate);
            return BigDecimal.ZERO;
        }
        return amountDecimal.multiply(rateDecimal, CONTEXT);
    }

    /**
     * 퍼센트 계산: value * percentage / 100
     *
     * @param percentage 퍼센트 값 (15%는 15)
     */
    public static BigDecimal calculatePercentage(Object value, Object percentage) {
        BigDecimal valueDecimal = toDecimal(value);
        BigDecimal percentDecimal = toDecimal(percentage);
        if (valueDecimal == null || percentDecimal == null) {
            log.error("퍼센트 계산 불가: value={}, percentage={}", value, percentage);
            return BigDecimal.ZERO;
        }
        return valueDecimal.multiply(percentDecimal, CONTEXT).divide(HUNDRED, CONTEXT);
    }

    /**
     * 금액 합산
     * null 이나 잘못된 값은 건너뛰고 나머지를 합산함
     */
    public static BigDecimal sumAmounts(Collection<?> amounts) {
        if (amounts == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (Object amount : amounts) {
            if (isBlank(amount)) {
                continue;
            }
            BigDecimal decimal = toDecimal(amount);
            if (decimal == null) {
                log.warn("합산에서 제외된 잘못된 금액: {}", amount);
                continue;
            }
            sum = sum.add(decimal, CONTEXT);
        }
        return sum;
    }

    /**
     * 소수점 2자리 반올림 (HALF_UP)
     */
    public static BigDecimal roundMoney(Object amount) {
        BigDecimal decimal = toDecimal(amount);
        if (decimal == null) {
            log.error("반올림 불가 금액: {}", amount);
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return decimal.setScale(SCALE, ROUNDING);
    }

    /**
     * 저장용 고정 소수점 값 (scale 2)
     * DECIMAL(12,2) 컬럼에 들어가는 모든 금액은 이 값을 사용
     */
    public static BigDecimal toFixed(BigDecimal amount) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    /**
     * 유효한 금액인지 확인 (유한한 수이고 0 이상)
     */
    public static boolean isValidMoneyAmount(Object amount) {
        if (isBlank(amount)) {
            return false;
        }
        BigDecimal decimal = toDecimal(amount);
        return decimal != null && decimal.signum() >= 0;
    }

    /**
     * 사용자 입력 금액 파싱
     * 천 단위 구분자, 공백, CFA/XOF 접미사를 제거한 뒤 파싱
     */
    public static Optional<BigDecimal> parseMoneyInput(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String cleaned = input
                .replaceAll("[,\\s]", "")
                .replaceAll("(?i)CFA", "")
                .replaceAll("(?i)XOF", "")
                .trim();
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal decimal = toDecimal(cleaned);
        if (decimal == null || decimal.signum() < 0) {
            return Optional.empty();
        }
        return Optional.of(decimal);
    }

    /**
     * 화면 표시용 포맷 (예: "1,234.56 CFA")
     */
    public static String formatMoney(Object amount) {
        return formatMoney(amount, DEFAULT_CURRENCY);
    }

    public static String formatMoney(Object amount, String currency) {
        BigDecimal decimal = isBlank(amount) ? null : toDecimal(amount);
        if (decimal == null) {
            return "0 CFA";
        }
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(ROUNDING);
        String formatted = format.format(decimal);

        if (currency == null || DEFAULT_CURRENCY.equalsIgnoreCase(currency) || "CFA".equalsIgnoreCase(currency)) {
            return formatted + " CFA";
        }
        return formatted + " " + currency;
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof CharSequence text && text.toString().isBlank());
    }

    /**
     * 지원 타입: BigDecimal, Number, CharSequence
     * 변환할 수 없거나 NaN/Infinity 이면 null
     */
    private static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return new BigDecimal(Double.toString(d));
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof CharSequence text) {
            try {
                return new BigDecimal(text.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
