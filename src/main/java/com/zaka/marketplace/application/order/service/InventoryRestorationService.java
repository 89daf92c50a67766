package com.zaka.marketplace.application.order.service;

import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.entity.OrderItem;
import com.zaka.marketplace.domain.order.exception.OrderNotCancelledException;
import com.zaka.marketplace.domain.order.exception.OrderNotFoundException;
import com.zaka.marketplace.domain.order.repository.OrderItemRepository;
import com.zaka.marketplace.domain.order.repository.OrderRepository;
import com.zaka.marketplace.domain.product.entity.Product;
import com.zaka.marketplace.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 재고 복원 서비스 (주문 취소 보상 트랜잭션)
 *
 * 주문 단위로 한 번만 실행됨:
 * orders.inventory_restored_at 을 조건부 UPDATE 로 선점한 호출만 재고를 되돌림
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryRestorationService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductRepository productRepository;

    @Transactional
    public RestorationResult restoreInventory(String orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        if (!order.isCancelled()) {
            throw new OrderNotCancelledException(orderId);
        }

        // 1. 복원 선점 (이미 복원된 주문이면 아무것도 하지 않음)
        if (orderRepository.claimInventoryRestoration(orderId, LocalDateTime.now()) == 0) {
            log.info("[INVENTORY] 이미 재고가 복원된 주문 - orderId={}", orderId);
            return RestorationResult.alreadyRestored(orderId);
        }

        // 2. 상품별 복원 수량 합산 (상품 ID 오름차순으로 락 획득)
        Map<String, Integer> quantityByProduct = new TreeMap<>();
        for (OrderItem item : orderItemRepository.findByOrderId(orderId)) {
            quantityByProduct.merge(item.getProductId(), item.getQuantity(), Integer::sum);
        }

        // 3. 수량을 추적하는 상품만 복원
        Map<String, Integer> restored = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : quantityByProduct.entrySet()) {
            String productId = entry.getKey();
            int quantity = entry.getValue();

            Optional<Product> product = productRepository.findByIdWithLock(productId);
            if (product.isEmpty()) {
                log.warn("[INVENTORY] 삭제된 상품은 복원하지 않음 - orderId={}, productId={}", orderId, productId);
                continue;
            }
            if (!product.get().isTracked()) {
                continue;
            }

            productRepository.increaseStock(productId, quantity);
            restored.put(productId, quantity);

            log.info("[INVENTORY] 재고 복원 - product=\"{}\", quantity={}, orderId={}",
                    product.get().getName(), quantity, orderId);
        }

        return new RestorationResult(orderId, true, Collections.unmodifiableMap(restored));
    }

    /**
     * 재고 복원 결과
     *
     * @param restored           이번 호출에서 복원을 수행했는지 여부
     * @param restoredQuantities 상품 ID별 복원 수량
     */
    public record RestorationResult(String orderId, boolean restored, Map<String, Integer> restoredQuantities) {

        static RestorationResult alreadyRestored(String orderId) {
            return new RestorationResult(orderId, false, Map.of());
        }

        public int totalRestoredUnits() {
            return restoredQuantities.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
