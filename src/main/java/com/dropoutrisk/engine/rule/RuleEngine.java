package com.dropoutrisk.engine.rule;

import com.dropoutrisk.engine.feature.Feature;
import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.model.Tier;

import java.util.OptionalDouble;

/**
 * Deterministic threshold rules. Side-effect free and safe to share between threads.
 *
 * Bands:
 * - attendance, academic: GREEN if value >= safe, YELLOW if value >= warning, RED otherwise
 * - financial (inverted): GREEN if ratio == 0, YELLOW if ratio <= warning ratio, RED otherwise
 * - a missing value is YELLOW, never GREEN
 * - academic is at least YELLOW once retakes exceed the configured maximum attempts
 */
public class RuleEngine {

    public RuleEvaluation evaluate(FeatureVector vector, ThresholdConfig config) {
        Tier attendance = banded(vector.value(Feature.ATTENDANCE_PERCENTAGE),
                config.attendanceSafe(), config.attendanceWarning());
        Tier academic = academicTier(vector, config);
        Tier financial = financialTier(vector.value(Feature.OVERDUE_FEES_RATIO), config.financialWarningRatio());

        return new RuleEvaluation(attendance, academic, financial,
                Tier.mostSevere(attendance, academic, financial), config.version());
    }

    private Tier academicTier(FeatureVector vector, ThresholdConfig config) {
        Tier tier = banded(vector.value(Feature.AVERAGE_SCORE), config.scoreSafe(), config.scoreWarning());
        OptionalDouble attempts = vector.value(Feature.ATTEMPT_COUNT);
        if (attempts.isPresent() && attempts.getAsDouble() > config.maxAttempts()) {
            tier = tier.atLeast(Tier.YELLOW);
        }
        return tier;
    }

    static Tier banded(OptionalDouble value, double safe, double warning) {
        if (value.isEmpty()) {
            return Tier.YELLOW;
        }
        double v = value.getAsDouble();
        if (v >= safe) {
            return Tier.GREEN;
        }
        return v >= warning ? Tier.YELLOW : Tier.RED;
    }

    static Tier financialTier(OptionalDouble ratio, double warningRatio) {
        if (ratio.isEmpty()) {
            return Tier.YELLOW;
        }
        double r = ratio.getAsDouble();
        if (r == 0.0) {
            return Tier.GREEN;
        }
        return r <= warningRatio ? Tier.YELLOW : Tier.RED;
    }
}
