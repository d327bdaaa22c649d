package com.dropoutrisk.config;

import com.dropoutrisk.engine.rule.ThresholdConfig;
import com.dropoutrisk.engine.training.TrainingSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings under the {@code dropout-risk} prefix in application.yml.
 *
 * Defaults mirror {@link ThresholdConfig#defaults()} and {@link TrainingSettings#defaults()},
 * so an empty section still starts a working engine.
 */
@Data
@ConfigurationProperties(prefix = "dropout-risk")
public class RiskEngineProperties {

    private Thresholds thresholds = new Thresholds();
    private Features features = new Features();
    private Model model = new Model();
    private Training training = new Training();

    @Data
    public static class Thresholds {
        private String version = "default";
        private double attendanceSafe = 75.0;
        private double attendanceWarning = 60.0;
        private double scoreSafe = 60.0;
        private double scoreWarning = 40.0;
        private double financialWarningRatio = 0.3;
        private int maxAttempts = 2;

        public ThresholdConfig toConfig() {
            return new ThresholdConfig(version, attendanceSafe, attendanceWarning, scoreSafe, scoreWarning,
                    financialWarningRatio, maxAttempts);
        }
    }

    @Data
    public static class Features {
        // Number of most recent exam sittings used for score statistics
        private int recentExamCount = 10;
        private int attemptCap = 5;
    }

    @Data
    public static class Model {
        private boolean persistenceEnabled = true;
        private String directory = "./models";
    }

    @Data
    public static class Training {
        private double holdoutFraction = 0.2;
        private long seed = 42L;
        private double promotionTolerance = 0.02;
        private int minExamples = 20;
        private double logisticLearningRate = 0.1;
        private int logisticIterations = 1000;
        private double logisticL2 = 0.01;
        private int forestTrees = 100;
        private int forestMaxDepth = 8;
        private int forestMinSamplesLeaf = 2;

        public TrainingSettings toSettings() {
            return new TrainingSettings(holdoutFraction, seed, promotionTolerance, minExamples,
                    logisticLearningRate, logisticIterations, logisticL2,
                    forestTrees, forestMaxDepth, forestMinSamplesLeaf);
        }
    }
}
