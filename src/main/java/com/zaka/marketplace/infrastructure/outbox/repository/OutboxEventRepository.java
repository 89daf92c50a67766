package com.zaka.marketplace.infrastructure.outbox.repository;

import com.zaka.marketplace.infrastructure.outbox.EventStatus;
import com.zaka.marketplace.infrastructure.outbox.entity.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Outbox 이벤트 Repository
 */
@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * 발행 대기 중이고 재시도 시간이 된 이벤트 조회 (생성 순)
     */
    @Query("SELECT e FROM OutboxEvent e WHERE e.status = :status AND e.nextRetryAt <= :now ORDER BY e.createdAt ASC")
    List<OutboxEvent> findPublishable(@Param("status") EventStatus status,
                                      @Param("now") LocalDateTime now,
                                      Pageable pageable);

    List<OutboxEvent> findByAggregateTypeAndAggregateIdOrderByCreatedAtAsc(String aggregateType, String aggregateId);

    /**
     * 보관 기간이 지난 PUBLISHED 이벤트 삭제
     */
    @Modifying
    @Query("DELETE FROM OutboxEvent e WHERE e.status = com.zaka.marketplace.infrastructure.outbox.EventStatus.PUBLISHED AND e.publishedAt < :cutoffDate")
    int deleteOldPublishedEvents(@Param("cutoffDate") LocalDateTime cutoffDate);
}
