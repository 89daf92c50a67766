package com.zaka.marketplace.domain.order.service;

import com.zaka.marketplace.common.money.Money;
import com.zaka.marketplace.domain.order.OrderStatus;
import com.zaka.marketplace.domain.order.command.OrderDraft;
import com.zaka.marketplace.domain.order.command.OrderLine;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.entity.OrderItem;
import com.zaka.marketplace.domain.order.exception.InvalidOrderAmountException;
import com.zaka.marketplace.domain.order.exception.InvalidOrderQuantityException;
import com.zaka.marketplace.domain.order.repository.OrderItemRepository;
import com.zaka.marketplace.domain.order.repository.OrderRepository;
import com.zaka.marketplace.domain.product.entity.Product;
import com.zaka.marketplace.domain.product.exception.InsufficientStockException;
import com.zaka.marketplace.domain.product.exception.ProductNotFoundException;
import com.zaka.marketplace.domain.product.repository.ProductRepository;
import com.zaka.marketplace.domain.vendor.entity.Vendor;
import com.zaka.marketplace.domain.vendor.exception.VendorNotFoundException;
import com.zaka.marketplace.domain.vendor.repository.VendorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 주문 생성 Facade
 *
 * 재고 확인/차감, 수수료 계산, 주문 저장을 하나의 흐름으로 묶음
 * 트랜잭션 경계와 커밋 이후 처리는 Application Layer(PlaceOrderService)에서 담당
 *
 * [동시성]
 * - 주문에 포함된 모든 상품을 상품 ID 오름차순으로 SELECT FOR UPDATE (데드락 방지)
 * - 락을 잡은 상태에서 전체 재고를 한 번에 검증 (하나라도 부족하면 아무것도 차감하지 않음)
 * - 차감은 조건부 UPDATE(quantity >= n)로 수행하고 영향 행 수를 다시 확인
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderPlacementFacade {

    private final ProductRepository productRepository;
    private final VendorRepository vendorRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final CommissionCalculator commissionCalculator;
    private final OrderNumberGenerator orderNumberGenerator;

    /**
     * 주문 생성 전체 흐름
     * 반드시 트랜잭션 안에서 호출되어야 함
     *
     * @param draft 주문 초안 (금액, 고객, 판매자)
     * @param lines 주문 항목
     * @return 생성된 주문, 주문 항목, 상품별 재고 차감 결과
     */
    public OrderPlacementResult placeOrder(OrderDraft draft, List<OrderLine> lines) {
        // 1. 요청 검증
        validateLines(lines);
        BigDecimal totalAmount = validateAmounts(draft);

        // 2. 상품별 요청 수량 합산 (같은 상품이 여러 줄에 있으면 합계로 검증)
        Map<String, Integer> requestedByProduct = aggregateQuantities(lines);

        // 3. 상품 조회 + 행 락
        Map<String, Product> products = lockProducts(requestedByProduct);

        // 4. 재고 확인 (전체 주문 단위 all-or-nothing)
        verifyStock(products, requestedByProduct);

        // 5. 판매자 조회 및 수수료 계산
        Vendor vendor = vendorRepository.findById(draft.vendorId())
                .orElseThrow(() -> new VendorNotFoundException(draft.vendorId()));
        CommissionSplit split = commissionCalculator.computeSplit(draft.subtotal(), vendor.getCommissionRate());

        // 6. 주문 번호 생성
        String orderNumber = orderNumberGenerator.generate();

        log.info("[COMMISSION] 주문 {} 수수료 분배 - subtotal={}, rate={}%, commission={}, vendorEarnings={}, platformRevenue={}, deliveryFee={}, tax={}, total={}",
                orderNumber, Money.toFixed(draft.subtotal()), split.rate(), split.commissionAmount(),
                split.vendorEarnings(), split.platformRevenue(), Money.toFixed(draft.deliveryFee()),
                Money.toFixed(draft.taxAmount()), totalAmount);

        // 7. 주문 저장
        Order order = orderRepository.save(Order.builder()
                .orderNumber(orderNumber)
                .customerId(draft.customerId())
                .vendorId(draft.vendorId())
                .status(OrderStatus.PENDING)
                .subtotal(Money.toFixed(draft.subtotal()))
                .deliveryFee(Money.toFixed(draft.deliveryFee()))
                .taxAmount(Money.toFixed(draft.taxAmount()))
                .totalAmount(totalAmount)
                .commissionRate(split.rate())
                .commissionAmount(split.commissionAmount())
                .vendorEarnings(split.vendorEarnings())
                .platformRevenue(split.platformRevenue())
                .notes(draft.notes())
                .build());

        // 8. 주문 항목 저장
        List<OrderItem> orderItems = saveOrderItems(order.getOrderId(), lines, products);

        // 9. 재고 차감
        List<StockReservation> reservations = reserveStock(orderNumber, products, requestedByProduct);

        log.info("[ORDER] 주문 생성 완료 - orderNumber={}, orderId={}, items={}",
                orderNumber, order.getOrderId(), orderItems.size());

        return new OrderPlacementResult(order, orderItems, reservations);
    }

    private void validateLines(List<OrderLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new InvalidOrderQuantityException("주문 항목이 비어있습니다");
        }
        for (OrderLine line : lines) {
            if (line.productId() == null || line.productId().isBlank()) {
                throw new InvalidOrderQuantityException("상품 ID가 없는 주문 항목이 있습니다");
            }
            if (line.quantity() <= 0) {
                throw new InvalidOrderQuantityException(
                        "주문 수량은 1 이상이어야 합니다: " + line.productId() + " (요청: " + line.quantity() + ")");
            }
        }
    }

    /**
     * 금액 검증
     * totalAmount 가 주어지면 subtotal + deliveryFee + taxAmount 와 일치해야 함
     *
     * @return 저장할 총 금액 (scale 2)
     */
    private BigDecimal validateAmounts(OrderDraft draft) {
        if (!Money.isValidMoneyAmount(draft.subtotal())) {
            throw new InvalidOrderAmountException("상품 금액이 올바르지 않습니다: " + draft.subtotal());
        }
        if (draft.deliveryFee() != null && !Money.isValidMoneyAmount(draft.deliveryFee())) {
            throw new InvalidOrderAmountException("배송비가 올바르지 않습니다: " + draft.deliveryFee());
        }
        if (draft.taxAmount() != null && !Money.isValidMoneyAmount(draft.taxAmount())) {
            throw new InvalidOrderAmountException("세금이 올바르지 않습니다: " + draft.taxAmount());
        }

        BigDecimal expectedTotal = Money.toFixed(Money.sumAmounts(
                List.of(Money.toFixed(draft.subtotal()), Money.toFixed(draft.deliveryFee()), Money.toFixed(draft.taxAmount()))));

        if (draft.totalAmount() == null) {
            return expectedTotal;
        }
        BigDecimal requestedTotal = Money.toFixed(draft.totalAmount());
        if (requestedTotal.compareTo(expectedTotal) != 0) {
            throw new InvalidOrderAmountException(String.format(
                    "총 금액이 일치하지 않습니다 (요청: %s, 계산: %s)", requestedTotal, expectedTotal));
        }
        return requestedTotal;
    }

    /**
     * 상품 ID 오름차순으로 요청 수량 합산
     */
    private Map<String, Integer> aggregateQuantities(List<OrderLine> lines) {
        Map<String, Integer> requested = new TreeMap<>();
        for (OrderLine line : lines) {
            try {
                requested.merge(line.productId(), line.quantity(), Math::addExact);
            } catch (ArithmeticException e) {
                throw new InvalidOrderQuantityException(
                        "주문 수량 합계가 허용 범위를 넘었습니다: " + line.productId());
            }
        }
        return requested;
    }

    /**
     * 상품 조회 (SELECT FOR UPDATE)
     * TreeMap 순서(상품 ID 오름차순)대로 락을 획득
     */
    private Map<String, Product> lockProducts(Map<String, Integer> requestedByProduct) {
        Map<String, Product> products = new LinkedHashMap<>();
        for (String productId : requestedByProduct.keySet()) {
            Product product = productRepository.findByIdWithLock(productId)
                    .orElseThrow(() -> new ProductNotFoundException(productId));
            products.put(productId, product);
        }
        return products;
    }

    private void verifyStock(Map<String, Product> products, Map<String, Integer> requestedByProduct) {
        for (Map.Entry<String, Integer> entry : requestedByProduct.entrySet()) {
            Product product = products.get(entry.getKey());
            int requested = entry.getValue();

            if (!product.canFulfill(requested)) {
                throw new InsufficientStockException(
                        product.getName(), product.getStock().quantity(), requested);
            }
        }
    }

    private List<OrderItem> saveOrderItems(String orderId, List<OrderLine> lines, Map<String, Product> products) {
        List<OrderItem> orderItems = lines.stream()
                .map(line -> {
                    Product product = products.get(line.productId());
                    return OrderItem.builder()
                            .orderId(orderId)
                            .productId(product.getProductId())
                            .productName(product.getName())
                            .quantity(line.quantity())
                            .unitPrice(Money.toFixed(product.getPrice()))
                            .build();
                })
                .toList();

        return orderItemRepository.saveAll(orderItems);
    }

    /**
     * 재고 차감 (직접 UPDATE 쿼리 사용)
     * 수량을 추적하지 않는 상품은 건너뜀
     */
    private List<StockReservation> reserveStock(String orderNumber,
                                                Map<String, Product> products,
                                                Map<String, Integer> requestedByProduct) {
        List<StockReservation> reservations = new ArrayList<>();

        for (Map.Entry<String, Integer> entry : requestedByProduct.entrySet()) {
            Product product = products.get(entry.getKey());
            int requested = entry.getValue();

            if (!product.isTracked()) {
                reservations.add(StockReservation.untracked(product, requested));
                continue;
            }

            int updated = productRepository.decreaseStock(product.getProductId(), requested);
            if (updated != 1) {
                // 락을 잡고 검증했으므로 정상적으로는 도달하지 않음
                throw new InsufficientStockException(
                        product.getName(), product.getStock().quantity(), requested);
            }

            int remaining = product.getStock().remainingAfter(requested);
            reservations.add(StockReservation.tracked(product, requested, remaining));

            log.info("[INVENTORY] 재고 차감 - orderNumber={}, productId={}, quantity={}, remaining={}",
                    orderNumber, product.getProductId(), requested, remaining);
        }
        return reservations;
    }

    /**
     * 상품별 재고 차감 결과
     */
    public record StockReservation(
            String productId,
            String vendorId,
            String productName,
            boolean tracked,
            int reservedQuantity,
            int remainingQuantity
    ) {
        static StockReservation tracked(Product product, int reserved, int remaining) {
            return new StockReservation(product.getProductId(), product.getVendorId(), product.getName(),
                    true, reserved, remaining);
        }

        static StockReservation untracked(Product product, int requested) {
            return new StockReservation(product.getProductId(), product.getVendorId(), product.getName(),
                    false, requested, product.getStock().quantity());
        }
    }

    /**
     * 주문 생성 결과
     */
    public record OrderPlacementResult(
            Order order,
            List<OrderItem> orderItems,
            List<StockReservation> reservations
    ) {
    }
}
