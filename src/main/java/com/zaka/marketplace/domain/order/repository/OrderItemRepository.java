package com.zaka.marketplace.domain.order.repository;

import com.zaka.marketplace.domain.order.entity.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OrderItemRepository extends JpaRepository<OrderItem, String> {

    List<OrderItem> findByOrderId(String orderId);

    long countByOrderId(String orderId);
}
