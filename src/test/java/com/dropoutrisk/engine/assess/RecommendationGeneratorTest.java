package com.dropoutrisk.engine.assess;

import com.dropoutrisk.engine.feature.Feature;
import com.dropoutrisk.engine.feature.FeatureSchema;
import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.engine.ml.Prediction;
import com.dropoutrisk.engine.rule.RuleEngine;
import com.dropoutrisk.engine.rule.RuleEvaluation;
import com.dropoutrisk.engine.rule.ThresholdConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();
    private final RuleEngine ruleEngine = new RuleEngine();

    private static FeatureVector vector(double attendance, double score, double overdue) {
        return FeatureVector.builder("STU-1", FeatureSchema.CURRENT)
                .set(Feature.ATTENDANCE_PERCENTAGE, attendance)
                .set(Feature.AVERAGE_SCORE, score)
                .set(Feature.OVERDUE_FEES_RATIO, overdue)
                .set(Feature.ATTEMPT_COUNT, 0)
                .build();
    }

    private RuleEvaluation rules(FeatureVector vector) {
        return ruleEngine.evaluate(vector, ThresholdConfig.defaults());
    }

    @Test
    @DisplayName("Should recommend nothing for a healthy student")
    void shouldStayQuietWhenHealthy() {
        FeatureVector vector = vector(90, 80, 0);

        assertThat(generator.generate(vector, rules(vector), null)).isEmpty();
    }

    @Test
    @DisplayName("Should recommend meetings for borderline attendance, score and fees")
    void shouldRecommendForWarningBands() {
        FeatureVector vector = vector(70, 55, 0.25);

        assertThat(generator.generate(vector, rules(vector), null)).containsExactly(
                "Schedule meeting with student and parents about attendance",
                "Implement attendance tracking and early warning system",
                "Schedule extra classes and academic counseling",
                "Assign peer mentor for academic support",
                "Schedule fee payment discussion",
                "Explore financial aid and payment plan options");
    }

    @Test
    @DisplayName("Should add urgent and comprehensive steps for a RED student")
    void shouldRecommendForCriticalStudent() {
        FeatureVector vector = vector(50, 30, 0.6);
        Prediction prediction = new Prediction(0.85, 0.7, "v1", Map.of());

        assertThat(generator.generate(vector, rules(vector), prediction))
                .contains("Immediate intervention required for attendance",
                        "Urgent academic support needed",
                        "Immediate financial counseling required",
                        "High dropout risk - implement comprehensive intervention plan",
                        "Schedule comprehensive counseling session",
                        "Involve parents/guardians in intervention plan",
                        "Weekly progress monitoring required");
    }

    @Test
    @DisplayName("Should flag moderate model risk even when rules are green")
    void shouldRecommendOnModerateProbability() {
        FeatureVector vector = vector(90, 80, 0);
        Prediction prediction = new Prediction(0.6, 0.2, "v1", Map.of());

        assertThat(generator.generate(vector, rules(vector), prediction))
                .containsExactly("Moderate dropout risk - monitor closely and provide support");
    }

    @Test
    @DisplayName("Should ask for records when a domain has no data")
    void shouldFlagMissingData() {
        FeatureVector vector = FeatureVector.builder("STU-1", FeatureSchema.CURRENT)
                .set(Feature.OVERDUE_FEES_RATIO, 0)
                .build();

        assertThat(generator.generate(vector, rules(vector), null))
                .anyMatch(r -> r.startsWith("No attendance recorded"))
                .anyMatch(r -> r.startsWith("No exam results recorded"));
    }
}
