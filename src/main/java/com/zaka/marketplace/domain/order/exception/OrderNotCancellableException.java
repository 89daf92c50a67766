package com.zaka.marketplace.domain.order.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;
import com.zaka.marketplace.domain.order.OrderStatus;

public class OrderNotCancellableException extends BusinessException {
    public OrderNotCancellableException(String orderId, OrderStatus status) {
        super(ErrorCode.O004, String.format("취소할 수 없는 주문입니다: %s (상태: %s)", orderId, status));
    }
}
