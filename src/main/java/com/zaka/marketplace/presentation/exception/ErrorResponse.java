package com.zaka.marketplace.presentation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * 에러 응답
 *
 * @param details 에러별 추가 정보 (예: 재고 부족 시 상품명, 현재 재고, 요청 수량)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        Map<String, Object> details
) {
    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }
}
