package com.zaka.marketplace.domain.order.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Year;

/**
 * 주문 번호 생성기
 *
 * 형식: {PREFIX}-{연도}-{10자리 코드}  (예: ZK-2026-7KQ2M9XH4D)
 * 코드는 SecureRandom 기반 32진 문자 10자리(50 bit)이며,
 * order_number 컬럼의 unique 제약이 최종 중복 방지선 역할을 함
 */
@Component
public class RandomOrderNumberGenerator implements OrderNumberGenerator {

    // 혼동되는 문자(0, O, 1, I) 제외
    private static final char[] ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZ".toCharArray();
    private static final int CODE_LENGTH = 10;

    private final SecureRandom random = new SecureRandom();
    private final String prefix;

    public RandomOrderNumberGenerator(@Value("${marketplace.order.number-prefix:ZK}") String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String generate() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return prefix + "-" + Year.now().getValue() + "-" + code;
    }
}
