package com.zaka.marketplace.application.order;

import com.zaka.marketplace.IntegrationTestBase;
import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.application.order.usecase.PlaceOrderUseCase;
import com.zaka.marketplace.domain.notification.NotificationType;
import com.zaka.marketplace.domain.notification.entity.Notification;
import com.zaka.marketplace.domain.order.OrderStatus;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.product.entity.Product;
import com.zaka.marketplace.domain.product.exception.InsufficientStockException;
import com.zaka.marketplace.domain.vendor.entity.Vendor;
import com.zaka.marketplace.domain.vendor.exception.VendorNotFoundException;
import com.zaka.marketplace.infrastructure.outbox.EventStatus;
import com.zaka.marketplace.infrastructure.outbox.entity.OutboxEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static com.zaka.marketplace.application.order.OrderRequests.line;
import static com.zaka.marketplace.application.order.OrderRequests.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("주문 생성 통합 테스트")
class PlaceOrderIntegrationTest extends IntegrationTestBase {

    @Autowired
    private PlaceOrderUseCase placeOrderUseCase;

    @Test
    @DisplayName("주문 생성 시 재고가 차감되고 수수료 분배가 주문에 저장된다")
    void 단순_주문() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);

        // when
        OrderResponse response = placeOrderUseCase.execute(
                request("C1", vendor.getVendorId(), "3000", line(p1.getProductId(), 3)));

        // then
        assertThat(response.status()).isEqualTo(OrderStatus.PENDING);
        assertThat(response.orderNumber()).startsWith("ZK-");
        assertThat(response.items()).hasSize(1);
        assertThat(orderItemRepository.countByOrderId(response.orderId())).isEqualTo(1);

        Order saved = orderRepository.findById(response.orderId()).orElseThrow();
        assertThat(saved.getCommissionRate()).isEqualByComparingTo("5.00");
        assertThat(saved.getCommissionAmount()).isEqualByComparingTo("150.00");
        assertThat(saved.getVendorEarnings()).isEqualByComparingTo("2850.00");
        assertThat(saved.getPlatformRevenue()).isEqualByComparingTo("150.00");
        assertThat(saved.getTotalAmount()).isEqualByComparingTo("3000.00");

        assertThat(quantityOf(p1)).isEqualTo(7);
    }

    @Test
    @DisplayName("주문 생성과 같은 트랜잭션에서 ORDER_PLACED Outbox 이벤트가 저장된다")
    void 주문_생성_이벤트_저장() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);

        // when
        OrderResponse response = placeOrderUseCase.execute(
                request("C1", vendor.getVendorId(), "2000", line(p1.getProductId(), 2)));

        // then
        List<OutboxEvent> events = outboxEventRepository
                .findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc("ORDER", response.orderId());
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getEventType()).isEqualTo("ORDER_PLACED");
            assertThat(event.getStatus()).isEqualTo(EventStatus.PENDING);
            assertThat(event.getPayload()).contains(response.orderNumber());
        });
    }

    @Test
    @DisplayName("재고가 부족하면 주문이 생성되지 않고 재고도 그대로 유지된다")
    void 재고_부족() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p2 = saveTrackedProduct(vendor, "아보카도 오일", 2);

        // when & then
        assertThatThrownBy(() -> placeOrderUseCase.execute(
                request("C1", vendor.getVendorId(), "5000", line(p2.getProductId(), 5))))
                .isInstanceOfSatisfying(InsufficientStockException.class, e -> {
                    assertThat(e.getAvailable()).isEqualTo(2);
                    assertThat(e.getRequested()).isEqualTo(5);
                });

        assertThat(quantityOf(p2)).isEqualTo(2);
        assertThat(orderRepository.count()).isZero();
        assertThat(orderItemRepository.count()).isZero();
        assertThat(outboxEventRepository.count()).isZero();
    }

    @Test
    @DisplayName("여러 상품 중 하나라도 재고가 부족하면 모든 상품의 재고가 유지된다")
    void 여러_상품_원자성() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);
        Product p2 = saveTrackedProduct(vendor, "아보카도 오일", 2);

        // when & then
        assertThatThrownBy(() -> placeOrderUseCase.execute(request("C1", vendor.getVendorId(), "8000",
                line(p1.getProductId(), 3), line(p2.getProductId(), 5))))
                .isInstanceOf(InsufficientStockException.class);

        assertThat(quantityOf(p1)).isEqualTo(10);
        assertThat(quantityOf(p2)).isEqualTo(2);
        assertThat(orderRepository.count()).isZero();
        assertThat(orderItemRepository.count()).isZero();
    }

    @Test
    @DisplayName("수량을 추적하지 않는 상품은 재고와 관계없이 주문되고 수량이 바뀌지 않는다")
    void 미추적_상품() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p3 = saveUntrackedProduct(vendor, "디지털 쿠폰");

        // when
        OrderResponse response = placeOrderUseCase.execute(
                request("C1", vendor.getVendorId(), "10000", line(p3.getProductId(), 100)));

        // then
        assertThat(response.orderId()).isNotNull();
        assertThat(quantityOf(p3)).isZero();
    }

    @Test
    @DisplayName("같은 상품이 여러 줄에 있으면 합계 수량만큼 차감되고 주문 항목은 줄마다 저장된다")
    void 중복_상품_줄() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);

        // when
        OrderResponse response = placeOrderUseCase.execute(request("C1", vendor.getVendorId(), "5000",
                line(p1.getProductId(), 2), line(p1.getProductId(), 3)));

        // then
        assertThat(response.items()).hasSize(2);
        assertThat(orderItemRepository.countByOrderId(response.orderId())).isEqualTo(2);
        assertThat(quantityOf(p1)).isEqualTo(5);
    }

    @Test
    @DisplayName("주문 이후 판매자 수수료율이 바뀌어도 기존 주문의 수수료는 바뀌지 않는다")
    void 수수료_고정() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);
        OrderResponse response = placeOrderUseCase.execute(
                request("C1", vendor.getVendorId(), "3000", line(p1.getProductId(), 3)));

        // when
        Vendor reloaded = vendorRepository.findById(vendor.getVendorId()).orElseThrow();
        reloaded.changeCommissionRate(new BigDecimal("12.00"));
        vendorRepository.save(reloaded);

        // then
        Order saved = orderRepository.findById(response.orderId()).orElseThrow();
        assertThat(saved.getCommissionRate()).isEqualByComparingTo("5.00");
        assertThat(saved.getCommissionAmount()).isEqualByComparingTo("150.00");
    }

    @Test
    @DisplayName("판매자 수수료율이 없으면 기본 수수료율이 적용된다")
    void 기본_수수료율() {
        // given
        Vendor vendor = saveVendor(null);
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);

        // when
        OrderResponse response = placeOrderUseCase.execute(
                request("C1", vendor.getVendorId(), "4000", line(p1.getProductId(), 4)));

        // then
        assertThat(response.commissionRate()).isEqualByComparingTo("5.00");
        assertThat(response.commissionAmount()).isEqualByComparingTo("200.00");
        assertThat(response.vendorEarnings()).isEqualByComparingTo("3800.00");
    }

    @Test
    @DisplayName("차감 후 재고가 임계값 이하이면 커밋 이후 판매자에게 재고 부족 알림이 생성된다")
    void 재고_부족_알림() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 6);

        // when
        placeOrderUseCase.execute(request("C1", vendor.getVendorId(), "3000", line(p1.getProductId(), 3)));

        // then
        List<Notification> notifications =
                notificationRepository.findByUserIdAndType(vendor.getUserId(), NotificationType.LOW_STOCK);
        assertThat(notifications).singleElement().satisfies(notification -> {
            assertThat(notification.getMessage()).contains("시어버터");
            assertThat(notification.getData()).contains("\"stockQuantity\":3");
        });
    }

    @Test
    @DisplayName("재고가 0이 되거나 임계값보다 많이 남으면 재고 부족 알림을 생성하지 않는다")
    void 재고_부족_알림_대상_아님() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product soldOut = saveTrackedProduct(vendor, "시어버터", 3);
        Product plenty = saveTrackedProduct(vendor, "아보카도 오일", 20);

        // when
        placeOrderUseCase.execute(request("C1", vendor.getVendorId(), "4000",
                line(soldOut.getProductId(), 3), line(plenty.getProductId(), 1)));

        // then
        assertThat(quantityOf(soldOut)).isZero();
        assertThat(notificationRepository.count()).isZero();
    }

    @Test
    @DisplayName("판매자가 존재하지 않으면 주문이 실패하고 재고가 유지된다")
    void 판매자_없음() {
        // given
        Vendor vendor = saveVendor("5.00");
        Product p1 = saveTrackedProduct(vendor, "시어버터", 10);

        // when & then
        assertThatThrownBy(() -> placeOrderUseCase.execute(
                request("C1", "UNKNOWN-VENDOR", "3000", line(p1.getProductId(), 3))))
                .isInstanceOf(VendorNotFoundException.class);

        assertThat(quantityOf(p1)).isEqualTo(10);
        assertThat(orderRepository.count()).isZero();
    }
}
