package com.zaka.marketplace.domain.order.service;

/**
 * 화면 표시용 주문 번호 생성기
 */
public interface OrderNumberGenerator {

    String generate();
}
