package com.zaka.marketplace.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * 코드, 기본 메시지, 응답 HTTP 상태를 함께 관리
 */
public enum ErrorCode {
    // 상품 관련 에러
    P001("P001", "상품을 찾을 수 없습니다", HttpStatus.BAD_REQUEST),
    P002("P002", "재고가 부족합니다", HttpStatus.BAD_REQUEST),
    P003("P003", "유효하지 않은 재고 수량입니다", HttpStatus.BAD_REQUEST),

    // 판매자 관련 에러 (데이터 정합성 문제 - 사용자에게 노출하지 않음)
    V001("V001", "판매자를 찾을 수 없습니다", HttpStatus.INTERNAL_SERVER_ERROR),

    // 주문 관련 에러
    O001("O001", "유효하지 않은 주문 수량입니다", HttpStatus.BAD_REQUEST),
    O002("O002", "주문을 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    O003("O003", "주문 금액이 올바르지 않습니다", HttpStatus.BAD_REQUEST),
    O004("O004", "취소할 수 없는 주문입니다", HttpStatus.CONFLICT),
    O005("O005", "취소되지 않은 주문은 재고를 복원할 수 없습니다", HttpStatus.CONFLICT),

    // 공통 에러
    COMMON001("COMMON001", "필수 파라미터가 누락되었습니다", HttpStatus.BAD_REQUEST),
    COMMON002("COMMON002", "잘못된 요청 형식입니다", HttpStatus.BAD_REQUEST),
    COMMON004("COMMON004", "서버 내부 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR),
    COMMON005("COMMON005", "요청을 처리 중입니다. 잠시 후 다시 시도해주세요", HttpStatus.CONFLICT);

    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(String code, String message, HttpStatus status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * 서버 측 문제로 분류되는 에러인지 여부 (5xx)
     */
    public boolean isServerError() {
        return status.is5xxServerError();
    }
}
