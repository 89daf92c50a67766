package com.zaka.marketplace.domain.order.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 주문 금액이 음수이거나 합계가 맞지 않을 때 발생하는 예외
 */
public class InvalidOrderAmountException extends BusinessException {
    public InvalidOrderAmountException(String message) {
        super(ErrorCode.O003, message);
    }
}
