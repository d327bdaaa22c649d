package com.dropoutrisk.producer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Sends event records to Kafka.
 *
 * Sends are asynchronous; the returned future completes when the broker acknowledges.
 * Callers that need delivery before moving on (the outbox publisher) wait on it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public CompletableFuture<SendResult<String, Object>> publish(String topic, String key, Object event) {
        String eventType = event.getClass().getSimpleName();
        log.debug("Publishing {} to {} with key {}", eventType, topic, key);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish {} with key {} to {}", eventType, key, topic, ex);
            } else {
                log.info("Published {} with key {} to {} partition {}",
                        eventType, key, topic, result.getRecordMetadata().partition());
            }
        });

        return future;
    }
}
