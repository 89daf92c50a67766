package com.zaka.marketplace;

import com.zaka.marketplace.domain.notification.repository.NotificationRepository;
import com.zaka.marketplace.domain.order.repository.OrderItemRepository;
import com.zaka.marketplace.domain.order.repository.OrderRepository;
import com.zaka.marketplace.domain.product.entity.Product;
import com.zaka.marketplace.domain.product.repository.ProductRepository;
import com.zaka.marketplace.domain.product.vo.Stock;
import com.zaka.marketplace.domain.vendor.entity.Vendor;
import com.zaka.marketplace.domain.vendor.repository.VendorRepository;
import com.zaka.marketplace.infrastructure.outbox.repository.OutboxEventRepository;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

/**
 * 통합 테스트 공통 설정 (H2 MySQL 모드)
 *
 * 커밋 이후 리스너와 행 락 동작을 검증해야 하므로 테스트 트랜잭션을 사용하지 않고
 * 각 테스트가 끝나면 데이터를 직접 삭제함
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestBase {

    @Autowired
    protected ProductRepository productRepository;

    @Autowired
    protected VendorRepository vendorRepository;

    @Autowired
    protected OrderRepository orderRepository;

    @Autowired
    protected OrderItemRepository orderItemRepository;

    @Autowired
    protected NotificationRepository notificationRepository;

    @Autowired
    protected OutboxEventRepository outboxEventRepository;

    @AfterEach
    void cleanUp() {
        outboxEventRepository.deleteAll();
        notificationRepository.deleteAll();
        orderItemRepository.deleteAll();
        orderRepository.deleteAll();
        productRepository.deleteAll();
        vendorRepository.deleteAll();
    }

    protected Vendor saveVendor(String commissionRate) {
        return vendorRepository.save(Vendor.builder()
                .userId("vendor-user-" + System.nanoTime())
                .businessName("다카르 코스메틱")
                .commissionRate(commissionRate != null ? new BigDecimal(commissionRate) : null)
                .build());
    }

    protected Product saveTrackedProduct(Vendor vendor, String name, int quantity) {
        return productRepository.save(Product.builder()
                .vendorId(vendor.getVendorId())
                .name(name)
                .price(new BigDecimal("1000.00"))
                .stock(Stock.tracked(quantity))
                .build());
    }

    protected Product saveUntrackedProduct(Vendor vendor, String name) {
        return productRepository.save(Product.builder()
                .vendorId(vendor.getVendorId())
                .name(name)
                .price(new BigDecimal("100.00"))
                .stock(Stock.untracked())
                .build());
    }

    protected int quantityOf(Product product) {
        return productRepository.findById(product.getProductId())
                .orElseThrow()
                .getStock()
                .quantity();
    }
}
