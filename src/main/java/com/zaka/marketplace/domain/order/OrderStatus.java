package com.zaka.marketplace.domain.order;

/**
 * 주문 상태
 * 상태 전이는 주문 상태 API 에서 관리하며, 이 모듈은 생성(PENDING)과 취소(CANCELLED)만 다룸
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    PREPARING,
    READY_FOR_PICKUP,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED;

    /**
     * 배송 완료된 주문과 이미 취소된 주문은 취소 전이 대상이 아님
     */
    public boolean isCancellable() {
        return this != DELIVERED && this != CANCELLED;
    }
}
