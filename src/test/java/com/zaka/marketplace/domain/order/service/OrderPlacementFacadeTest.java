package com.zaka.marketplace.domain.order.service;

import com.zaka.marketplace.domain.order.command.OrderDraft;
import com.zaka.marketplace.domain.order.command.OrderLine;
import com.zaka.marketplace.domain.order.entity.Order;
import com.zaka.marketplace.domain.order.exception.InvalidOrderAmountException;
import com.zaka.marketplace.domain.order.exception.InvalidOrderQuantityException;
import com.zaka.marketplace.domain.order.repository.OrderItemRepository;
import com.zaka.marketplace.domain.order.repository.OrderRepository;
import com.zaka.marketplace.domain.order.service.OrderPlacementFacade.OrderPlacementResult;
import com.zaka.marketplace.domain.order.service.OrderPlacementFacade.StockReservation;
import com.zaka.marketplace.domain.product.entity.Product;
import com.zaka.marketplace.domain.product.exception.InsufficientStockException;
import com.zaka.marketplace.domain.product.exception.ProductNotFoundException;
import com.zaka.marketplace.domain.product.repository.ProductRepository;
import com.zaka.marketplace.domain.product.vo.Stock;
import com.zaka.marketplace.domain.vendor.entity.Vendor;
import com.zaka.marketplace.domain.vendor.exception.VendorNotFoundException;
import com.zaka.marketplace.domain.vendor.repository.VendorRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("주문 생성 Facade 단위 테스트")
class OrderPlacementFacadeTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private VendorRepository vendorRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderItemRepository orderItemRepository;

    @Spy
    private CommissionCalculator commissionCalculator = new CommissionCalculator(new BigDecimal("5.00"));

    @Mock
    private OrderNumberGenerator orderNumberGenerator;

    @InjectMocks
    private OrderPlacementFacade orderPlacementFacade;

    @Test
    @DisplayName("재고를 차감하고 수수료가 고정된 주문을 생성한다")
    void 주문_생성_성공() {
        // given
        Product product = trackedProduct("P1", "시어버터", 10);
        givenLocked(product);
        givenVendor(new BigDecimal("5.00"));
        givenPersistence();
        given(productRepository.decreaseStock("P1", 3)).willReturn(1);

        // when
        OrderPlacementResult result = orderPlacementFacade.placeOrder(
                draft(new BigDecimal("3000")), List.of(new OrderLine("P1", 3)));

        // then
        Order order = result.order();
        assertThat(order.getOrderNumber()).isEqualTo("ZK-2026-ABCDEFGHJK");
        assertThat(order.getSubtotal()).isEqualTo(new BigDecimal("3000.00"));
        assertThat(order.getTotalAmount()).isEqualTo(new BigDecimal("3000.00"));
        assertThat(order.getCommissionRate()).isEqualTo(new BigDecimal("5.00"));
        assertThat(order.getCommissionAmount()).isEqualTo(new BigDecimal("150.00"));
        assertThat(order.getVendorEarnings()).isEqualTo(new BigDecimal("2850.00"));
        assertThat(order.getPlatformRevenue()).isEqualTo(new BigDecimal("150.00"));

        assertThat(result.orderItems()).hasSize(1);
        assertThat(result.orderItems().get(0).getUnitPrice()).isEqualTo(new BigDecimal("1000.00"));
        assertThat(result.orderItems().get(0).getProductName()).isEqualTo("시어버터");

        assertThat(result.reservations())
                .extracting(StockReservation::productId, StockReservation::remainingQuantity)
                .containsExactly(tuple("P1", 7));
        verify(productRepository).decreaseStock("P1", 3);
    }

    @Test
    @DisplayName("재고가 부족하면 상품명, 현재 재고, 요청 수량과 함께 실패하고 아무것도 저장하지 않는다")
    void 재고_부족() {
        // given
        givenLocked(trackedProduct("P2", "아보카도 오일", 2));

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("5000")), List.of(new OrderLine("P2", 5))))
                .isInstanceOfSatisfying(InsufficientStockException.class, e -> {
                    assertThat(e.getProductName()).isEqualTo("아보카도 오일");
                    assertThat(e.getAvailable()).isEqualTo(2);
                    assertThat(e.getRequested()).isEqualTo(5);
                });

        verify(orderRepository, never()).save(any());
        verify(productRepository, never()).decreaseStock(anyString(), anyInt());
    }

    @Test
    @DisplayName("여러 상품 중 하나라도 재고가 부족하면 어떤 상품의 재고도 차감하지 않는다")
    void 일부_상품_재고_부족() {
        // given
        givenLocked(trackedProduct("P1", "시어버터", 10));
        givenLocked(trackedProduct("P2", "아보카도 오일", 1));

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("5000")),
                List.of(new OrderLine("P1", 3), new OrderLine("P2", 2))))
                .isInstanceOf(InsufficientStockException.class);

        verify(productRepository, never()).decreaseStock(anyString(), anyInt());
        verify(orderItemRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("같은 상품이 여러 줄에 있으면 수량 합계로 재고를 확인한다")
    void 중복_상품_수량_합산() {
        // given
        givenLocked(trackedProduct("P1", "시어버터", 5));

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("7000")),
                List.of(new OrderLine("P1", 3), new OrderLine("P1", 4))))
                .isInstanceOfSatisfying(InsufficientStockException.class,
                        e -> assertThat(e.getRequested()).isEqualTo(7));
    }

    @Test
    @DisplayName("상품 락은 요청 순서와 관계없이 상품 ID 오름차순으로 획득한다")
    void 락_획득_순서() {
        // given
        givenLocked(trackedProduct("P1", "시어버터", 10));
        givenLocked(trackedProduct("P2", "아보카도 오일", 10));
        givenVendor(null);
        givenPersistence();
        given(productRepository.decreaseStock(anyString(), anyInt())).willReturn(1);

        // when
        orderPlacementFacade.placeOrder(draft(new BigDecimal("3000")),
                List.of(new OrderLine("P2", 1), new OrderLine("P1", 2)));

        // then
        InOrder inOrder = inOrder(productRepository);
        inOrder.verify(productRepository).findByIdWithLock("P1");
        inOrder.verify(productRepository).findByIdWithLock("P2");
    }

    @Test
    @DisplayName("수량을 추적하지 않는 상품은 재고를 차감하지 않는다")
    void 미추적_상품() {
        // given
        Product product = Product.builder()
                .productId("P3").vendorId("V1").name("디지털 쿠폰")
                .price(new BigDecimal("100")).stock(Stock.untracked())
                .build();
        givenLocked(product);
        givenVendor(null);
        givenPersistence();

        // when
        OrderPlacementResult result = orderPlacementFacade.placeOrder(
                draft(new BigDecimal("10000")), List.of(new OrderLine("P3", 100)));

        // then
        assertThat(result.reservations()).singleElement()
                .satisfies(reservation -> assertThat(reservation.tracked()).isFalse());
        verify(productRepository, never()).decreaseStock(anyString(), anyInt());
    }

    @Test
    @DisplayName("조건부 차감이 반영되지 않으면 재고 부족으로 실패한다")
    void 조건부_차감_실패() {
        // given
        givenLocked(trackedProduct("P1", "시어버터", 10));
        givenVendor(null);
        givenPersistence();
        given(productRepository.decreaseStock("P1", 3)).willReturn(0);

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("3000")), List.of(new OrderLine("P1", 3))))
                .isInstanceOf(InsufficientStockException.class);
    }

    @Test
    @DisplayName("존재하지 않는 상품이면 실패한다")
    void 상품_없음() {
        // given
        given(productRepository.findByIdWithLock("NOPE")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("1000")), List.of(new OrderLine("NOPE", 1))))
                .isInstanceOf(ProductNotFoundException.class);
    }

    @Test
    @DisplayName("판매자가 없으면 데이터 정합성 오류로 실패하고 재고를 차감하지 않는다")
    void 판매자_없음() {
        // given
        givenLocked(trackedProduct("P1", "시어버터", 10));
        given(vendorRepository.findById("V1")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("3000")), List.of(new OrderLine("P1", 3))))
                .isInstanceOf(VendorNotFoundException.class);

        verify(orderRepository, never()).save(any());
        verify(productRepository, never()).decreaseStock(anyString(), anyInt());
    }

    @Test
    @DisplayName("주문 항목이 비어있거나 수량이 0 이하이면 실패한다")
    void 주문_항목_검증() {
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(draft(BigDecimal.TEN), List.of()))
                .isInstanceOf(InvalidOrderQuantityException.class);

        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(BigDecimal.TEN), List.of(new OrderLine("P1", 0))))
                .isInstanceOf(InvalidOrderQuantityException.class);
    }

    @Test
    @DisplayName("같은 상품의 수량 합계가 int 범위를 넘으면 수량 검증 오류로 실패하고 상품을 조회하지 않는다")
    void 수량_합계_범위_초과() {
        // given
        List<OrderLine> lines = List.of(
                new OrderLine("P1", Integer.MAX_VALUE),
                new OrderLine("P1", 1));

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(draft(BigDecimal.TEN), lines))
                .isInstanceOf(InvalidOrderQuantityException.class)
                .hasMessageContaining("P1");
        verify(productRepository, never()).findByIdWithLock(anyString());
    }

    @Test
    @DisplayName("총 금액이 상품 금액, 배송비, 세금의 합과 다르면 실패한다")
    void 총_금액_불일치() {
        // given
        OrderDraft draft = new OrderDraft("C1", "V1", new BigDecimal("3000"),
                new BigDecimal("500"), BigDecimal.ZERO, new BigDecimal("3400"), null);

        // when & then
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(draft, List.of(new OrderLine("P1", 1))))
                .isInstanceOf(InvalidOrderAmountException.class);
        verify(productRepository, never()).findByIdWithLock(anyString());
    }

    @Test
    @DisplayName("음수 금액은 허용하지 않는다")
    void 음수_금액() {
        assertThatThrownBy(() -> orderPlacementFacade.placeOrder(
                draft(new BigDecimal("-1")), List.of(new OrderLine("P1", 1))))
                .isInstanceOf(InvalidOrderAmountException.class);
    }

    private OrderDraft draft(BigDecimal subtotal) {
        return new OrderDraft("C1", "V1", subtotal, null, null, null, null);
    }

    private Product trackedProduct(String productId, String name, int quantity) {
        return Product.builder()
                .productId(productId)
                .vendorId("V1")
                .name(name)
                .price(new BigDecimal("1000"))
                .stock(Stock.tracked(quantity))
                .build();
    }

    private void givenLocked(Product product) {
        given(productRepository.findByIdWithLock(product.getProductId())).willReturn(Optional.of(product));
    }

    private void givenVendor(BigDecimal commissionRate) {
        Vendor vendor = Vendor.builder()
                .vendorId("V1")
                .userId("USER-V1")
                .businessName("다카르 코스메틱")
                .commissionRate(commissionRate)
                .build();
        given(vendorRepository.findById("V1")).willReturn(Optional.of(vendor));
    }

    private void givenPersistence() {
        given(orderNumberGenerator.generate()).willReturn("ZK-2026-ABCDEFGHJK");
        given(orderRepository.save(any(Order.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(orderItemRepository.saveAll(anyList())).willAnswer(invocation -> invocation.getArgument(0));
    }
}
