package com.dropoutrisk.service;

import com.dropoutrisk.event.ModelLifecycleChanged;
import com.dropoutrisk.event.RiskAssessmentCompleted;
import com.dropoutrisk.event.RiskTierChanged;
import com.dropoutrisk.model.OutboxEvent;
import com.dropoutrisk.producer.EventProducer;
import com.dropoutrisk.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * OUTBOX EVENT PUBLISHER
 * ======================
 *
 * 1. Polls the outbox for unpublished rows, oldest first
 * 2. Deserializes each payload back into its event record
 * 3. Sends it to Kafka and waits for the acknowledgement
 * 4. Marks the row published; on failure bumps the retry count and moves on
 *
 * Rows are retried on every poll until Kafka accepts them, so delivery is at-least-once.
 * Consumers of these topics key their own idempotency on the event ids.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxEventPublisher {

    private static final int BATCH_SIZE = 100;
    private static final int MAX_RETRY_COUNT = 10;
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private static final Map<String, Class<?>> EVENT_TYPES = Map.of(
            RiskAssessmentCompleted.class.getSimpleName(), RiskAssessmentCompleted.class,
            RiskTierChanged.class.getSimpleName(), RiskTierChanged.class,
            ModelLifecycleChanged.class.getSimpleName(), ModelLifecycleChanged.class);

    private final OutboxEventRepository outboxEventRepository;
    private final EventProducer eventProducer;
    private final ObjectMapper objectMapper;

    @Scheduled(fixedDelayString = "${dropout-risk.outbox.poll-interval-ms:100}")
    @Transactional
    public void publishEvents() {
        try {
            List<OutboxEvent> events = outboxEventRepository.findUnpublishedEventsWithLimit(BATCH_SIZE);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                try {
                    publishEvent(event);
                } catch (Exception e) {
                    handlePublishError(event, e);
                }
            }
        } catch (Exception e) {
            log.error("Error in outbox event publisher", e);
        }
    }

    void publishEvent(OutboxEvent outboxEvent) throws Exception {
        Object event = objectMapper.readValue(outboxEvent.getPayload(), eventClass(outboxEvent.getEventType()));

        eventProducer.publish(outboxEvent.getTopic(), outboxEvent.getMessageKey(), event)
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        outboxEvent.setPublished(true);
        outboxEvent.setPublishedAt(Instant.now());
        outboxEventRepository.save(outboxEvent);

        log.debug("Published outbox event {} ({})", outboxEvent.getEventId(), outboxEvent.getEventType());
    }

    static Class<?> eventClass(String eventType) {
        Class<?> type = EVENT_TYPES.get(eventType);
        if (type == null) {
            throw new IllegalArgumentException("Unknown event type: " + eventType);
        }
        return type;
    }

    private void handlePublishError(OutboxEvent event, Exception e) {
        event.setRetryCount(event.getRetryCount() + 1);
        event.setLastError(e.getMessage());
        outboxEventRepository.save(event);

        if (event.getRetryCount() >= MAX_RETRY_COUNT) {
            log.error("Event {} has failed {} times. Manual intervention may be required. Error: {}",
                      event.getEventId(), event.getRetryCount(), e.getMessage());
        } else {
            log.warn("Failed to publish event {} (attempt {}): {}",
                     event.getEventId(), event.getRetryCount(), e.getMessage());
        }
    }

    @Scheduled(fixedDelay = 60000)
    public void monitorStuckEvents() {
        try {
            Instant threshold = Instant.now().minusSeconds(300);
            List<OutboxEvent> stuckEvents = outboxEventRepository.findByPublishedFalseAndCreatedAtBefore(threshold);

            if (!stuckEvents.isEmpty()) {
                log.error("Found {} outbox events older than 5 minutes still unpublished", stuckEvents.size());
                stuckEvents.forEach(event ->
                    log.error("Stuck event: id={}, eventId={}, eventType={}, createdAt={}, retryCount={}, lastError={}",
                              event.getId(), event.getEventId(), event.getEventType(),
                              event.getCreatedAt(), event.getRetryCount(), event.getLastError())
                );
            }

            long queueSize = outboxEventRepository.countByPublishedFalse();
            if (queueSize > 1000) {
                log.warn("Outbox queue size is {}", queueSize);
            } else {
                log.debug("Outbox queue size: {}", queueSize);
            }
        } catch (Exception e) {
            log.error("Error monitoring stuck events", e);
        }
    }
}
