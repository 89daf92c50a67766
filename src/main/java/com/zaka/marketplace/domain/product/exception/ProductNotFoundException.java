package com.zaka.marketplace.domain.product.exception;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없을 때 발생하는 예외
 * 클라이언트의 장바구니 정보가 오래되었음을 의미
 */
public class ProductNotFoundException extends BusinessException {

    private final String productId;

    public ProductNotFoundException(String productId) {
        super(ErrorCode.P001, "상품을 찾을 수 없습니다: " + productId);
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }
}
