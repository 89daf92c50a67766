package com.zaka.marketplace.domain.order.entity;

import com.zaka.marketplace.domain.common.BaseEntity;
import com.zaka.marketplace.domain.order.OrderStatus;
import com.zaka.marketplace.domain.order.exception.OrderNotCancellableException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 엔티티
 *
 * 수수료 관련 컬럼(commissionRate ~ platformRevenue)은 판매 시점의 스냅샷이며
 * 생성 이후 다시 계산하거나 수정하지 않음 (updatable = false)
 * 상태 변경 시 변경된 컬럼만 UPDATE 하여 inventory_restored_at 을 덮어쓰지 않음
 */
@Entity
@DynamicUpdate
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_vendor_id", columnList = "vendor_id"),
        @Index(name = "idx_orders_customer_id", columnList = "customer_id"),
        @Index(name = "idx_orders_status_created_at", columnList = "status, created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Order extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String orderId;

    // 화면 표시용 주문 번호 (PK 로 사용하지 않음)
    @Column(name = "order_number", nullable = false, unique = true, updatable = false)
    private String orderNumber;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private String customerId;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private String vendorId;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    @Column(name = "subtotal", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal subtotal;

    @Column(name = "delivery_fee", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal deliveryFee;

    @Column(name = "tax_amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal taxAmount;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "commission_rate", nullable = false, precision = 5, scale = 2, updatable = false)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal commissionAmount;

    @Column(name = "vendor_earnings", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal vendorEarnings;

    @Column(name = "platform_revenue", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal platformRevenue;

    @Column(name = "currency", nullable = false, updatable = false)
    @Builder.Default
    private String currency = "CFA";

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    // 재고 복원 완료 시각 (재고 복원 중복 실행 방지)
    @Column(name = "inventory_restored_at")
    private LocalDateTime inventoryRestoredAt;

    /**
     * 주문 취소
     *
     * @return 상태가 실제로 변경되었으면 true, 이미 취소된 주문이면 false
     * @throws OrderNotCancellableException 배송 완료된 주문인 경우
     */
    public boolean cancel() {
        if (this.status == OrderStatus.CANCELLED) {
            return false;
        }
        if (!this.status.isCancellable()) {
            throw new OrderNotCancellableException(this.orderId, this.status);
        }
        this.status = OrderStatus.CANCELLED;
        this.cancelledAt = LocalDateTime.now();
        return true;
    }

    public boolean isCancelled() {
        return this.status == OrderStatus.CANCELLED;
    }
}
