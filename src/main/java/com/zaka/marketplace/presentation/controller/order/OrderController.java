package com.zaka.marketplace.presentation.controller.order;

import com.zaka.marketplace.application.order.dto.OrderResponse;
import com.zaka.marketplace.application.order.dto.PlaceOrderRequest;
import com.zaka.marketplace.application.order.usecase.CancelOrderUseCase;
import com.zaka.marketplace.application.order.usecase.GetOrderDetailUseCase;
import com.zaka.marketplace.application.order.usecase.PlaceOrderUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 주문 API
 */
@Tag(name = "주문", description = "주문 생성, 취소 및 조회 API")
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final PlaceOrderUseCase placeOrderUseCase;
    private final CancelOrderUseCase cancelOrderUseCase;
    private final GetOrderDetailUseCase getOrderDetailUseCase;

    /**
     * 주문 생성
     * POST /api/orders
     */
    @Operation(summary = "주문 생성", description = "재고를 차감하고 판매자 수수료를 계산하여 주문을 생성합니다")
    @PostMapping
    public ResponseEntity<OrderResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        OrderResponse response = placeOrderUseCase.execute(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 주문 취소
     * POST /api/orders/{orderId}/cancel
     */
    @Operation(summary = "주문 취소", description = "주문을 취소하고 차감된 재고를 복원합니다. 이미 취소된 주문은 그대로 반환합니다")
    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @Parameter(description = "주문 ID") @PathVariable String orderId) {

        return ResponseEntity.ok(cancelOrderUseCase.execute(orderId));
    }

    @Operation(summary = "주문 상세 조회", description = "주문 정보와 주문 항목을 조회합니다")
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderDetail(
            @Parameter(description = "주문 ID") @PathVariable String orderId) {

        return ResponseEntity.ok(getOrderDetailUseCase.execute(orderId));
    }
}
