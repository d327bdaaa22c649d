package com.dropoutrisk.engine.rule;

import com.dropoutrisk.exception.ThresholdConfigException;

/**
 * Versioned rule-band boundaries. Immutable once constructed.
 *
 * Validation runs in the compact constructor, so an instance that exists is a valid
 * configuration: safe bands sit strictly above warning bands for attendance and score.
 */
public record ThresholdConfig(
    String version,
    double attendanceSafe,
    double attendanceWarning,
    double scoreSafe,
    double scoreWarning,
    double financialWarningRatio,
    int maxAttempts
) {
    public ThresholdConfig {
        if (version == null || version.isBlank()) {
            throw new ThresholdConfigException("Threshold config version cannot be null or empty");
        }
        if (!(attendanceSafe > attendanceWarning)) {
            throw new ThresholdConfigException(String.format(
                    "Config %s: attendance safe threshold %.2f must be greater than warning threshold %.2f",
                    version, attendanceSafe, attendanceWarning));
        }
        if (!(scoreSafe > scoreWarning)) {
            throw new ThresholdConfigException(String.format(
                    "Config %s: score safe threshold %.2f must be greater than warning threshold %.2f",
                    version, scoreSafe, scoreWarning));
        }
        if (!(financialWarningRatio > 0.0 && financialWarningRatio <= 1.0)) {
            throw new ThresholdConfigException(String.format(
                    "Config %s: financial warning ratio %.3f must be in (0, 1]", version, financialWarningRatio));
        }
        if (maxAttempts < 0) {
            throw new ThresholdConfigException(
                    "Config " + version + ": max attempts cannot be negative, was " + maxAttempts);
        }
    }

    /**
     * Default bands: attendance 75/60, score 60/40, overdue ratio 0.3, two retakes.
     */
    public static ThresholdConfig defaults() {
        return new ThresholdConfig("default", 75.0, 60.0, 60.0, 40.0, 0.3, 2);
    }
}
