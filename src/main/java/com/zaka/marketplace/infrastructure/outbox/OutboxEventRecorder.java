package com.zaka.marketplace.infrastructure.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaka.marketplace.infrastructure.outbox.entity.OutboxEvent;
import com.zaka.marketplace.infrastructure.outbox.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Outbox 이벤트 저장
 * 호출한 비즈니스 트랜잭션에 참여하므로 주문 저장과 이벤트 저장이 함께 커밋/롤백됨
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventRecorder {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public OutboxEvent record(String aggregateType, String aggregateId, String eventType, Object payload) {
        OutboxEvent outboxEvent = OutboxEvent.builder()
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payload(serialize(aggregateId, payload))
                .status(EventStatus.PENDING)
                .retryCount(0)
                .build();

        outboxEventRepository.save(outboxEvent);

        log.info("Outbox 이벤트 저장 완료 - aggregateId={}, eventType={}, eventId={}",
                aggregateId, eventType, outboxEvent.getId());
        return outboxEvent;
    }

    private String serialize(String aggregateId, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Outbox 이벤트 JSON 직렬화 실패 - aggregateId={}", aggregateId, e);
            throw new IllegalStateException("이벤트 저장 실패", e);
        }
    }
}
