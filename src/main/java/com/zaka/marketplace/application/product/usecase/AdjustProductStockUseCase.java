package com.zaka.marketplace.application.product.usecase;

import com.zaka.marketplace.application.product.dto.AdjustStockRequest;
import com.zaka.marketplace.application.product.dto.ProductStockResponse;
import com.zaka.marketplace.domain.product.entity.Product;
import com.zaka.marketplace.domain.product.event.LowStockDetectedEvent;
import com.zaka.marketplace.domain.product.exception.ProductNotFoundException;
import com.zaka.marketplace.domain.product.repository.ProductRepository;
import com.zaka.marketplace.domain.product.service.LowStockPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 판매자 수동 재고 조정 유스케이스
 *
 * 주문/재고 복원과 같은 행 락(SELECT FOR UPDATE)을 사용해 재고를 변경
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdjustProductStockUseCase {

    private final ProductRepository productRepository;
    private final LowStockPolicy lowStockPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public ProductStockResponse execute(String productId, AdjustStockRequest request) {
        Product product = productRepository.findByIdWithLock(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        int before = product.getStock().quantity();
        product.adjustStock(request.quantity());

        log.info("[INVENTORY] 재고 수동 조정 - productId={}, {} -> {}, 사유: {}",
                productId, before, request.quantity(),
                request.reason() != null ? request.reason() : "수동 조정");

        if (product.isTracked() && lowStockPolicy.isLow(request.quantity())) {
            eventPublisher.publishEvent(new LowStockDetectedEvent(
                    product.getProductId(), product.getVendorId(), product.getName(), request.quantity()));
        }

        return ProductStockResponse.from(product);
    }
}
