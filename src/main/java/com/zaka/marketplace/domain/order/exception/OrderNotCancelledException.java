package com.zaka.marketplace.domain.order.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

public class OrderNotCancelledException extends BusinessException {
    public OrderNotCancelledException(String orderId) {
        super(ErrorCode.O005, "취소되지 않은 주문은 재고를 복원할 수 없습니다: " + orderId);
    }
}
