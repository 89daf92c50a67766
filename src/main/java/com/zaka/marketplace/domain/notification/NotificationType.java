package com.zaka.marketplace.domain.notification;

public enum NotificationType {
    LOW_STOCK,
    ORDER_STATUS,
    SYSTEM
}
