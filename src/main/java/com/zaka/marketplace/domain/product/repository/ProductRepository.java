package com.zaka.marketplace.domain.product.repository;

import com.zaka.marketplace.domain.product.entity.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * 상품 저장소 인터페이스
 *
 * 재고를 바꾸는 모든 경로(주문, 재고 복원, 수동 조정)는
 * findByIdWithLock 으로 행 락을 잡거나 아래의 원자적 UPDATE 를 사용해야 함
 */
public interface ProductRepository extends JpaRepository<Product, String> {

    /**
     * 상품 조회 (비관적 락)
     * SELECT FOR UPDATE로 동시성 제어
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.productId = :productId")
    Optional<Product> findByIdWithLock(@Param("productId") String productId);

    /**
     * 재고 차감 (직접 UPDATE 쿼리)
     *
     * DB 레벨 재고 검증 포함:
     * - 재고가 충분할 때만 UPDATE 실행
     * - 재고 부족 시 affected rows = 0 반환
     *
     * @return 업데이트된 행 수 (1: 성공, 0: 재고 부족)
     */
    @Modifying
    @Query("UPDATE Product p SET p.stock.quantity = p.stock.quantity - :amount " +
            "WHERE p.productId = :productId AND p.stock.trackQuantity = true AND p.stock.quantity >= :amount")
    int decreaseStock(@Param("productId") String productId, @Param("amount") int amount);

    /**
     * 재고 복원 (직접 UPDATE 쿼리)
     * 수량을 추적하는 상품만 대상
     */
    @Modifying
    @Query("UPDATE Product p SET p.stock.quantity = p.stock.quantity + :amount " +
            "WHERE p.productId = :productId AND p.stock.trackQuantity = true")
    int increaseStock(@Param("productId") String productId, @Param("amount") int amount);
}
