package com.dropoutrisk.config;

import com.dropoutrisk.engine.assess.RecommendationGenerator;
import com.dropoutrisk.engine.assess.RiskAssessor;
import com.dropoutrisk.engine.assess.RiskChangeDetector;
import com.dropoutrisk.engine.feature.FeatureExtractor;
import com.dropoutrisk.engine.feature.FeatureSchema;
import com.dropoutrisk.engine.ml.FileModelArtifactStore;
import com.dropoutrisk.engine.ml.MLPredictor;
import com.dropoutrisk.engine.ml.ModelArtifactStore;
import com.dropoutrisk.engine.ml.ModelLifecycleListener;
import com.dropoutrisk.engine.ml.ModelRegistry;
import com.dropoutrisk.engine.rule.RuleEngine;
import com.dropoutrisk.engine.rule.ThresholdConfigHolder;
import com.dropoutrisk.engine.training.ModelTrainer;
import com.dropoutrisk.engine.training.TrainingSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Wires the framework-free engine classes into the Spring context.
 *
 * The engine itself knows nothing about Spring, Kafka or JPA; everything it needs
 * (thresholds, model snapshot, clock) is handed in from here or by the services.
 */
@Configuration
@EnableConfigurationProperties(RiskEngineProperties.class)
@Slf4j
public class RiskEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeatureExtractor featureExtractor(RiskEngineProperties properties) {
        RiskEngineProperties.Features features = properties.getFeatures();
        return new FeatureExtractor(FeatureSchema.CURRENT, features.getRecentExamCount(), features.getAttemptCap());
    }

    @Bean
    public RuleEngine ruleEngine() {
        return new RuleEngine();
    }

    @Bean
    public ThresholdConfigHolder thresholdConfigHolder(RiskEngineProperties properties) {
        return new ThresholdConfigHolder(properties.getThresholds().toConfig());
    }

    @Bean
    public ModelArtifactStore modelArtifactStore(RiskEngineProperties properties, ObjectMapper objectMapper) {
        RiskEngineProperties.Model model = properties.getModel();
        if (!model.isPersistenceEnabled()) {
            log.warn("Model persistence disabled, trained models live only as long as this process");
            return ModelArtifactStore.NONE;
        }
        return new FileModelArtifactStore(Path.of(model.getDirectory()), objectMapper);
    }

    /**
     * Registry restored from storage; every lifecycle listener bean is attached before restore.
     */
    @Bean
    public ModelRegistry modelRegistry(ModelArtifactStore store, List<ModelLifecycleListener> listeners) {
        ModelRegistry registry = new ModelRegistry(store);
        listeners.forEach(registry::addListener);
        registry.restore();
        if (registry.active().isEmpty()) {
            log.warn("No active model, assessments will be rule-only until a model is promoted");
        }
        return registry;
    }

    @Bean
    public MLPredictor mlPredictor(ModelRegistry modelRegistry) {
        return new MLPredictor(modelRegistry);
    }

    @Bean
    public RiskAssessor riskAssessor(FeatureExtractor featureExtractor, RuleEngine ruleEngine,
                                     MLPredictor mlPredictor) {
        return new RiskAssessor(featureExtractor, ruleEngine, mlPredictor, new RecommendationGenerator());
    }

    @Bean
    public RiskChangeDetector riskChangeDetector() {
        return new RiskChangeDetector();
    }

    @Bean
    public ModelTrainer modelTrainer(FeatureExtractor featureExtractor, ModelRegistry modelRegistry,
                                     MLPredictor mlPredictor, RiskEngineProperties properties, Clock clock) {
        TrainingSettings settings = properties.getTraining().toSettings();
        return new ModelTrainer(featureExtractor, modelRegistry, mlPredictor,
                ModelTrainer.defaultMembers(settings), settings, clock);
    }
}
