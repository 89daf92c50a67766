package com.zaka.marketplace.domain.order.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외
 */
public class OrderNotFoundException extends BusinessException {
    public OrderNotFoundException(String orderId) {
        super(ErrorCode.O002, "주문을 찾을 수 없습니다: " + orderId);
    }
}
