package com.dropoutrisk.engine.rule;

import com.dropoutrisk.engine.feature.Feature;
import com.dropoutrisk.engine.feature.FeatureExtractor;
import com.dropoutrisk.engine.feature.FeatureSchema;
import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.model.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.OptionalDouble;

import static com.dropoutrisk.engine.StudentFixtures.student;
import static org.assertj.core.api.Assertions.*;

class RuleEngineTest {

    private RuleEngine ruleEngine;
    private ThresholdConfig thresholds;

    @BeforeEach
    void setUp() {
        ruleEngine = new RuleEngine();
        thresholds = ThresholdConfig.defaults();
    }

    @ParameterizedTest(name = "attendance {0}% -> {1}")
    @CsvSource({"100, GREEN", "75, GREEN", "74.99, YELLOW", "60, YELLOW", "59.99, RED", "0, RED"})
    @DisplayName("Should band attendance against safe and warning thresholds")
    void shouldBandAttendance(double attendance, Tier expected) {
        assertThat(RuleEngine.banded(OptionalDouble.of(attendance), 75, 60)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "overdue ratio {0} -> {1}")
    @CsvSource({"0.0, GREEN", "0.01, YELLOW", "0.3, YELLOW", "0.31, RED", "1.0, RED"})
    @DisplayName("Should band the overdue ratio in the inverted direction")
    void shouldBandFinancialRatio(double ratio, Tier expected) {
        assertThat(RuleEngine.financialTier(OptionalDouble.of(ratio), 0.3)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should treat a missing value as YELLOW, never GREEN")
    void shouldTreatMissingAsYellow() {
        assertThat(RuleEngine.banded(OptionalDouble.empty(), 75, 60)).isEqualTo(Tier.YELLOW);
        assertThat(RuleEngine.financialTier(OptionalDouble.empty(), 0.3)).isEqualTo(Tier.YELLOW);
    }

    @Test
    @DisplayName("Should take the most severe domain tier as overall tier")
    void shouldAggregateMostSevere() {
        FeatureVector vector = FeatureVector.builder("STU-1", FeatureSchema.CURRENT)
                .set(Feature.ATTENDANCE_PERCENTAGE, 40)
                .set(Feature.AVERAGE_SCORE, 90)
                .set(Feature.OVERDUE_FEES_RATIO, 0)
                .set(Feature.ATTEMPT_COUNT, 0)
                .build();

        RuleEvaluation evaluation = ruleEngine.evaluate(vector, thresholds);

        assertThat(evaluation.attendanceTier()).isEqualTo(Tier.RED);
        assertThat(evaluation.academicTier()).isEqualTo(Tier.GREEN);
        assertThat(evaluation.financialTier()).isEqualTo(Tier.GREEN);
        assertThat(evaluation.overallTier()).isEqualTo(Tier.RED);
        assertThat(evaluation.thresholdVersion()).isEqualTo("default");
    }

    @Test
    @DisplayName("Should raise academic tier to YELLOW when retakes exceed the limit")
    void shouldEscalateOnExcessAttempts() {
        FeatureVector vector = FeatureVector.builder("STU-1", FeatureSchema.CURRENT)
                .set(Feature.ATTENDANCE_PERCENTAGE, 95)
                .set(Feature.AVERAGE_SCORE, 80)
                .set(Feature.OVERDUE_FEES_RATIO, 0)
                .set(Feature.ATTEMPT_COUNT, 3)
                .build();

        assertThat(ruleEngine.evaluate(vector, thresholds).academicTier()).isEqualTo(Tier.YELLOW);
    }

    @Test
    @DisplayName("Scenario: 70% attendance, 55% score, 0.2 overdue is YELLOW across the board")
    void shouldRateBorderlineStudentYellow() {
        FeatureExtractor extractor = new FeatureExtractor(FeatureSchema.CURRENT, 10, 5);

        RuleEvaluation evaluation = ruleEngine.evaluate(extractor.extract(student("STU-1", 70, 55, 0.2)), thresholds);

        assertThat(evaluation.attendanceTier()).isEqualTo(Tier.YELLOW);
        assertThat(evaluation.academicTier()).isEqualTo(Tier.YELLOW);
        assertThat(evaluation.financialTier()).isEqualTo(Tier.YELLOW);
        assertThat(evaluation.overallTier()).isEqualTo(Tier.YELLOW);
    }

    @Test
    @DisplayName("Scenario: 80% attendance, 75% score, no overdue fees is GREEN across the board")
    void shouldRateHealthyStudentGreen() {
        FeatureExtractor extractor = new FeatureExtractor(FeatureSchema.CURRENT, 10, 5);

        RuleEvaluation evaluation = ruleEngine.evaluate(extractor.extract(student("STU-2", 80, 75, 0.0)), thresholds);

        assertThat(evaluation.attendanceTier()).isEqualTo(Tier.GREEN);
        assertThat(evaluation.academicTier()).isEqualTo(Tier.GREEN);
        assertThat(evaluation.financialTier()).isEqualTo(Tier.GREEN);
        assertThat(evaluation.overallTier()).isEqualTo(Tier.GREEN);
    }
}
