package com.zaka.marketplace.infrastructure.aop;

import com.zaka.marketplace.common.exception.BusinessException;
import com.zaka.marketplace.common.exception.ErrorCode;

/**
 * 분산 락 획득 실패 (같은 키로 처리 중인 요청이 있음)
 */
public class DistributedLockException extends BusinessException {

    public DistributedLockException(String lockKey) {
        super(ErrorCode.COMMON005, "다른 요청을 처리 중입니다: " + lockKey);
    }

    public DistributedLockException(String lockKey, Throwable cause) {
        super(ErrorCode.COMMON005, "락 획득 중 인터럽트가 발생했습니다: " + lockKey, cause);
    }
}
