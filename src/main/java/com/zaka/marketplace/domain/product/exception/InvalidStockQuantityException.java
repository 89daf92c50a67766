package com.zaka.marketplace.domain.product.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 재고 수량이 음수로 설정되려 할 때 발생하는 예외
 */
public class InvalidStockQuantityException extends BusinessException {
    public InvalidStockQuantityException(int quantity) {
        super(ErrorCode.P003, "재고는 음수일 수 없습니다: " + quantity);
    }
}
