package com.zaka.marketplace.domain.order.repository;

import com.zaka.marketplace.domain.order.entity.Order;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * 주문 조회 (비관적 락)
     * 취소 처리 시 동일 주문에 대한 동시 요청 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") String orderId);

    /**
     * 재고 복원 선점
     *
     * inventory_restored_at 이 비어 있을 때만 기록하므로
     * 같은 주문에 대해 두 번 호출되어도 한 번만 1을 반환함
     *
     * @return 1: 이번 호출이 복원 권한을 얻음, 0: 이미 복원된 주문
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Order o SET o.inventoryRestoredAt = :restoredAt " +
            "WHERE o.orderId = :orderId AND o.inventoryRestoredAt IS NULL")
    int claimInventoryRestoration(@Param("orderId") String orderId,
                                  @Param("restoredAt") LocalDateTime restoredAt);
}
