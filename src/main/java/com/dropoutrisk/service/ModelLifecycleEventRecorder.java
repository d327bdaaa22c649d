package com.dropoutrisk.service;

import com.dropoutrisk.config.KafkaTopics;
import com.dropoutrisk.engine.ml.LifecycleState;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.ModelLifecycleListener;
import com.dropoutrisk.event.ModelLifecycleChanged;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Turns model registry transitions into {@link ModelLifecycleChanged} events on the outbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelLifecycleEventRecorder implements ModelLifecycleListener {

    private final OutboxWriter outboxWriter;
    private final Clock clock;

    @Override
    @Transactional
    public void onTransition(ModelArtifact artifact, LifecycleState from, LifecycleState to) {
        record(new ModelLifecycleChanged(artifact.version(), from, to, false, metricOf(artifact),
                from == null ? "staged" : from + " -> " + to, clock.instant()));
    }

    @Override
    @Transactional
    public void onPromotionRejected(ModelArtifact staged, String reason) {
        record(new ModelLifecycleChanged(staged.version(), staged.state(), staged.state(), true,
                metricOf(staged), reason, clock.instant()));
    }

    private void record(ModelLifecycleChanged event) {
        String eventId = event.modelVersion() + ":" + event.toState() + (event.rejected() ? ":rejected" : "");
        outboxWriter.write(event, eventId, event.modelVersion(), KafkaTopics.MODEL_LIFECYCLE_CHANGED);
        log.info("Recorded lifecycle event for model {}: {}", event.modelVersion(), event.detail());
    }

    private static Double metricOf(ModelArtifact artifact) {
        double metric = artifact.holdoutMetric();
        return Double.isNaN(metric) ? null : metric;
    }
}
