package com.dropoutrisk.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TRANSACTIONAL OUTBOX
 * ====================
 *
 * Assessment rows and the events describing them are written in one database
 * transaction. {@code OutboxEventPublisher} polls this table and forwards the rows
 * to Kafka, so a stored assessment always produces its events eventually and a
 * rolled-back assessment never produces any.
 */
@Entity
@Table(name = "outbox_events",
       indexes = {
           @Index(name = "idx_published", columnList = "published"),
           @Index(name = "idx_created_at", columnList = "createdAt")
       })
@Data
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Business id of the event (assessment id, model version).
     */
    @Column(nullable = false)
    private String eventId;

    /**
     * Simple class name of the event record, used to deserialize the payload.
     */
    @Column(nullable = false)
    private String eventType;

    /**
     * Kafka record key; student id or model version, so events for one subject stay ordered.
     */
    @Column(nullable = false)
    private String messageKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private String topic;

    @Column(nullable = false)
    private Boolean published = false;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant publishedAt;

    @Column(nullable = false)
    private Integer retryCount = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (published == null) {
            published = false;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }
}
