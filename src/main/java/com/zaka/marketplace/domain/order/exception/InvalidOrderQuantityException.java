package com.zaka.marketplace.domain.order.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 주문 항목이 없거나 수량이 올바르지 않을 때 발생하는 예외
 */
public class InvalidOrderQuantityException extends BusinessException {
    public InvalidOrderQuantityException(String message) {
        super(ErrorCode.O001, message);
    }
}
