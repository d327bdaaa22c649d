package com.dropoutrisk.consumer;

import com.dropoutrisk.config.KafkaTopics;
import com.dropoutrisk.event.StudentAssessmentRequested;
import com.dropoutrisk.exception.InsufficientDataException;
import com.dropoutrisk.exception.ModelVersionMismatchException;
import com.dropoutrisk.service.AssessmentService;
import com.dropoutrisk.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Assesses students on request from upstream systems (attendance imports, exam result loads).
 *
 * The request id is claimed in Redis first, so a redelivered request is assessed once.
 * A student without any data, or a model built for another feature schema, is a permanent
 * failure for that request: it is logged and dropped. Anything else releases the claim and
 * propagates so the container redelivers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssessmentRequestConsumer {

    private static final String EVENT_TYPE = "StudentAssessmentRequested";

    private final IdempotencyService idempotencyService;
    private final AssessmentService assessmentService;

    @KafkaListener(
            topics = KafkaTopics.STUDENT_ASSESSMENT_REQUESTED,
            groupId = "risk-assessment-group",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onAssessmentRequested(StudentAssessmentRequested event) {
        log.info("Received StudentAssessmentRequested {} for student {}",
                event.requestId(), event.records().studentId());

        if (!idempotencyService.tryAcquire(EVENT_TYPE, event.requestId(), "AssessmentRequestConsumer")) {
            log.warn("Assessment request already processed, skipping: {}", event.requestId());
            return;
        }

        try {
            assessmentService.assess(event.records(), event.requestId());
        } catch (InsufficientDataException e) {
            log.warn("Request {} dropped: {}", event.requestId(), e.getMessage());
        } catch (ModelVersionMismatchException e) {
            log.error("Request {} dropped, active model cannot score this student: {}",
                    event.requestId(), e.getMessage());
        } catch (RuntimeException e) {
            idempotencyService.release(EVENT_TYPE, event.requestId());
            throw e;
        }
    }
}
