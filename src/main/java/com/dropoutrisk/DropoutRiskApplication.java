package com.dropoutrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Dropout risk engine service.
 *
 * Flow:
 * Kafka / REST -> AssessmentService -> RiskAssessor (rules + model) -> Database (assessment + outbox)
 *   -> Outbox Publisher -> Kafka (risk.assessment.completed, risk.tier.changed)
 *
 * Kafka (model.training.requested) -> ModelTrainer -> ModelRegistry -> Outbox -> model.lifecycle.changed
 */
@SpringBootApplication
@EnableScheduling
public class DropoutRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(DropoutRiskApplication.class, args);
    }
}
