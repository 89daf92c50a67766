package com.zaka.marketplace.domain.product.entity;

import com.zaka.marketplace.domain.common.BaseEntity;
import com.zaka.marketplace.domain.product.vo.Stock;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
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

import java.math.BigDecimal;

/**
 * 상품 엔티티
 * 재고 수량 변경은 ProductRepository 의 원자적 UPDATE 또는 비관적 락 조회 후에만 수행
 */
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_vendor_id", columnList = "vendor_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Product extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String productId;

    @Column(name = "vendor_id", nullable = false)
    private String vendorId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Embedded
    private Stock stock;

    public boolean isTracked() {
        return stock.trackQuantity();
    }

    public boolean canFulfill(int requestedQuantity) {
        return stock.canFulfill(requestedQuantity);
    }

    /* 판매자 수동 재고 조정 (락 획득 후 호출) */
    public void adjustStock(int newQuantity) {
        this.stock = stock.adjustTo(newQuantity);
    }
}
