package com.dropoutrisk.repository;

import com.dropoutrisk.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * Oldest unpublished events first, at most {@code limit} of them.
     */
    @Query(value = "SELECT * FROM outbox_events WHERE published = false ORDER BY created_at ASC, id ASC LIMIT ?1",
           nativeQuery = true)
    List<OutboxEvent> findUnpublishedEventsWithLimit(int limit);

    List<OutboxEvent> findByPublishedFalseAndCreatedAtBefore(Instant before);

    long countByPublishedFalse();
}
