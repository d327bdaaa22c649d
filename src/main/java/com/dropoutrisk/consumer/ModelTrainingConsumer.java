package com.dropoutrisk.consumer;

import com.dropoutrisk.config.KafkaTopics;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.training.ModelTrainer;
import com.dropoutrisk.engine.training.TrainingDataset;
import com.dropoutrisk.event.TrainingDatasetSubmitted;
import com.dropoutrisk.exception.ModelLifecycleException;
import com.dropoutrisk.exception.ModelQualityRegressionException;
import com.dropoutrisk.exception.TrainingDataException;
import com.dropoutrisk.service.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Trains and promotes models from submitted datasets.
 *
 * Runs on its own single-threaded container, never on the assessment path. Assessments keep
 * reading the current ACTIVE model while training runs; only the final promotion swaps it.
 * A rejected or failed run leaves the previous model serving and is reported at ERROR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelTrainingConsumer {

    private static final String EVENT_TYPE = "TrainingDatasetSubmitted";

    private final IdempotencyService idempotencyService;
    private final ModelTrainer modelTrainer;

    @KafkaListener(
            topics = KafkaTopics.MODEL_TRAINING_REQUESTED,
            groupId = "model-training-group",
            containerFactory = "trainingListenerContainerFactory"
    )
    public void onTrainingRequested(TrainingDatasetSubmitted event) {
        log.info("Received TrainingDatasetSubmitted {} with {} examples", event.datasetId(), event.examples().size());

        if (!idempotencyService.tryAcquire(EVENT_TYPE, event.datasetId(), "ModelTrainingConsumer")) {
            log.warn("Dataset already trained on, skipping: {}", event.datasetId());
            return;
        }

        try {
            ModelArtifact active = modelTrainer.trainAndPromote(new TrainingDataset(event.datasetId(), event.examples()));
            log.info("Dataset {} produced active model {} ({} = {})", event.datasetId(), active.version(),
                    active.metadata().metricName(), active.holdoutMetric());
        } catch (ModelQualityRegressionException e) {
            log.error("Model {} from dataset {} not promoted: {}", e.getStagedVersion(), event.datasetId(),
                    e.getMessage());
        } catch (TrainingDataException | ModelLifecycleException e) {
            log.error("Training on dataset {} failed: {}", event.datasetId(), e.getMessage(), e);
        }
    }
}
