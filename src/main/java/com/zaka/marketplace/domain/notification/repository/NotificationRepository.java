package com.zaka.marketplace.domain.notification.repository;

import com.zaka.marketplace.domain.notification.NotificationType;
import com.zaka.marketplace.domain.notification.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NotificationRepository extends JpaRepository<Notification, String> {

    List<Notification> findByUserIdAndType(String userId, NotificationType type);
}
