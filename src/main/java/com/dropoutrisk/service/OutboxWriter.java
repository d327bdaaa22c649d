package com.dropoutrisk.service;

import com.dropoutrisk.exception.RiskEngineException;
import com.dropoutrisk.model.OutboxEvent;
import com.dropoutrisk.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Serializes an event into the outbox table. Joins the caller's transaction, so the event
 * commits or rolls back together with the business data written alongside it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public OutboxEvent write(Object event, String eventId, String messageKey, String topic) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for outbox: {}", eventId, e);
            throw new RiskEngineException("Failed to save event to outbox: " + eventId, e);
        }

        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(eventId);
        outboxEvent.setEventType(event.getClass().getSimpleName());
        outboxEvent.setMessageKey(messageKey);
        outboxEvent.setPayload(payload);
        outboxEvent.setTopic(topic);

        OutboxEvent saved = outboxEventRepository.save(outboxEvent);
        log.debug("Saved {} {} to outbox for topic {}", outboxEvent.getEventType(), eventId, topic);
        return saved;
    }
}
