package com.zaka.marketplace.infrastructure.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산 락 어노테이션
 *
 * key 는 SpEL 로 평가되며 "lock:" 접두사가 붙음
 * 예: @DistributedLock(key = "'order:customer:' + #request.customerId")
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    String key();

    TimeUnit timeUnit() default TimeUnit.SECONDS;

    // 락 획득 대기 시간
    long waitTime() default 5L;

    // 락 자동 해제 시간
    long leaseTime() default 3L;
}
