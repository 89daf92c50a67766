package com.zaka.marketplace.infrastructure.outbox.entity;

import com.zaka.marketplace.infrastructure.outbox.EventStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Outbox 이벤트 엔티티
 * 주문 트랜잭션과 같은 트랜잭션에서 저장되고, 커밋 이후 Publisher 가 Kafka 로 전달
 */
@Entity
@Table(name = "event_outbox", indexes = {
        @Index(name = "idx_outbox_status_retry", columnList = "status, next_retry_at"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboxEvent {

    private static final long BASE_BACKOFF_SECONDS = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "aggregate_type", nullable = false)
    private String aggregateType;  // ORDER

    @Column(name = "aggregate_id", nullable = false)
    private String aggregateId;    // 주문 ID

    @Column(name = "event_type", nullable = false)
    private String eventType;      // ORDER_PLACED, ORDER_CANCELLED

    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private EventStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.retryCount == null) {
            this.retryCount = 0;
        }
        if (this.status == null) {
            this.status = EventStatus.PENDING;
        }
        if (this.nextRetryAt == null) {
            this.nextRetryAt = LocalDateTime.now();
        }
    }

    /**
     * 발행 성공 처리
     */
    public void markAsPublished() {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = LocalDateTime.now();
        this.errorMessage = null;
    }

    /**
     * 발행 최종 실패 처리
     */
    public void markAsFailed() {
        this.status = EventStatus.FAILED;
    }

    /**
     * 재시도 카운트 증가 및 다음 재시도 시간 설정
     * Exponential Backoff: 20초 → 40초 → 80초 → ...
     */
    public void incrementRetryCount(String errorMessage) {
        this.retryCount++;
        this.errorMessage = errorMessage;
        this.nextRetryAt = LocalDateTime.now().plusSeconds((1L << this.retryCount) * BASE_BACKOFF_SECONDS);
    }

    public boolean canRetry(int maxRetryCount) {
        return this.retryCount < maxRetryCount && this.status == EventStatus.PENDING;
    }
}
