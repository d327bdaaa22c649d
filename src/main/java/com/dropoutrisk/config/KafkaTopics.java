package com.dropoutrisk.config;

/**
 * Centralized Kafka topic names.
 */
public class KafkaTopics {

    // Inbound: assess one student from the records in the event
    public static final String STUDENT_ASSESSMENT_REQUESTED = "student.assessment.requested";

    // Inbound: train a candidate model on a labeled dataset
    public static final String MODEL_TRAINING_REQUESTED = "model.training.requested";

    // Outbound: every stored assessment
    public static final String RISK_ASSESSMENT_COMPLETED = "risk.assessment.completed";

    // Outbound: final tier differs from the student's previous assessment
    public static final String RISK_TIER_CHANGED = "risk.tier.changed";

    // Outbound: model staged, validated, promoted, retired or rejected
    public static final String MODEL_LIFECYCLE_CHANGED = "model.lifecycle.changed";

    private KafkaTopics() {
    }
}
