package com.zaka.marketplace.domain.order.entity;

import com.zaka.marketplace.domain.order.OrderStatus;
import com.zaka.marketplace.domain.order.exception.OrderNotCancellableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("주문 엔티티 테스트")
class OrderTest {

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"PENDING", "CONFIRMED", "PREPARING", "READY_FOR_PICKUP", "IN_TRANSIT"})
    @DisplayName("배송 완료 전 주문은 취소할 수 있다")
    void 주문_취소(OrderStatus status) {
        // given
        Order order = Order.builder().orderId("O1").status(status).build();

        // when
        boolean changed = order.cancel();

        // then
        assertThat(changed).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getCancelledAt()).isNotNull();
    }

    @Test
    @DisplayName("이미 취소된 주문을 다시 취소하면 상태 변경 없이 false 를 반환한다")
    void 중복_취소() {
        Order order = Order.builder().orderId("O1").status(OrderStatus.CANCELLED).build();

        assertThat(order.cancel()).isFalse();
        assertThat(order.getCancelledAt()).isNull();
    }

    @Test
    @DisplayName("배송 완료된 주문은 취소할 수 없다")
    void 배송_완료_주문_취소_불가() {
        Order order = Order.builder().orderId("O1").status(OrderStatus.DELIVERED).build();

        assertThatThrownBy(order::cancel)
                .isInstanceOf(OrderNotCancellableException.class);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERED);
    }
}
