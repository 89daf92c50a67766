package com.zaka.marketplace.infrastructure.outbox.publisher;

import com.zaka.marketplace.infrastructure.outbox.EventStatus;
import com.zaka.marketplace.infrastructure.outbox.entity.OutboxEvent;
import com.zaka.marketplace.infrastructure.outbox.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Outbox 이벤트를 Kafka로 발행하는 Scheduler
 *
 * 주기적으로 PENDING 상태의 이벤트를 조회하여 Kafka로 발행
 * 발행 실패 시 Exponential Backoff 재시도, 최대 횟수 초과 시 FAILED
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "marketplace.outbox.relay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OutboxEventPublisher {

    static final int MAX_RETRY_COUNT = 5;
    static final int BATCH_SIZE = 20;
    static final String ORDER_TOPIC = "order-events";
    private static final long SEND_TIMEOUT_SECONDS = 3;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    /**
     * 5초마다 PENDING 이벤트를 조회하여 Kafka로 발행
     */
    @Scheduled(fixedDelayString = "${marketplace.outbox.relay.fixed-delay-ms:5000}")
    @Transactional
    public void publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPublishable(
                EventStatus.PENDING, LocalDateTime.now(), PageRequest.of(0, BATCH_SIZE));

        if (pendingEvents.isEmpty()) {
            return;
        }

        log.info("Outbox 이벤트 발행 시작 - 대상: {}건", pendingEvents.size());

        int successCount = 0;
        int failCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                publishToKafka(event);
                event.markAsPublished();
                successCount++;

                log.debug("이벤트 발행 성공 - eventId={}, aggregateId={}, eventType={}",
                        event.getId(), event.getAggregateId(), event.getEventType());

            } catch (InterruptedException e) {
                // 남은 이벤트는 재시도 횟수를 쓰지 않고 다음 주기에 발행
                Thread.currentThread().interrupt();
                log.warn("Outbox 이벤트 발행 중단 (인터럽트) - eventId={}, 미처리: {}건",
                        event.getId(), pendingEvents.size() - successCount - failCount);
                break;
            } catch (Exception e) {
                handlePublishFailure(event, e);
                failCount++;

                log.warn("이벤트 발행 실패 - eventId={}, retryCount={}, error={}",
                        event.getId(), event.getRetryCount(), e.getMessage());
            }

            outboxEventRepository.save(event);
        }

        log.info("Outbox 이벤트 발행 완료 - 성공: {}건, 실패: {}건", successCount, failCount);
    }

    /**
     * Kafka로 이벤트 발행
     * 브로커 응답까지 기다려 실패를 재시도 대상으로 돌림
     */
    private void publishToKafka(OutboxEvent event) throws Exception {
        String topic = getTopicByAggregateType(event.getAggregateType());
        kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private String getTopicByAggregateType(String aggregateType) {
        return switch (aggregateType) {
            case "ORDER" -> ORDER_TOPIC;
            default -> "default-events";
        };
    }

    private void handlePublishFailure(OutboxEvent event, Exception e) {
        event.incrementRetryCount(e.getMessage());

        if (!event.canRetry(MAX_RETRY_COUNT)) {
            event.markAsFailed();
            log.error("이벤트 발행 최종 실패 - eventId={}, aggregateId={}, maxRetry 초과",
                    event.getId(), event.getAggregateId());
        }
    }

    /**
     * 매일 자정에 30일 이상 지난 PUBLISHED 이벤트 삭제
     */
    @Scheduled(cron = "0 0 0 * * *")
    @Transactional
    public void cleanupOldPublishedEvents() {
        LocalDateTime cutoffDate = LocalDateTime.now().minusDays(30);
        int deleted = outboxEventRepository.deleteOldPublishedEvents(cutoffDate);
        log.info("오래된 Outbox 이벤트 정리 완료 - cutoffDate={}, deleted={}", cutoffDate, deleted);
    }
}
