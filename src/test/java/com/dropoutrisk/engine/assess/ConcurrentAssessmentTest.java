package com.dropoutrisk.engine.assess;

import com.dropoutrisk.engine.feature.FeatureExtractor;
import com.dropoutrisk.engine.feature.FeatureSchema;
import com.dropoutrisk.engine.feature.StudentRecords;
import com.dropoutrisk.engine.ml.LifecycleState;
import com.dropoutrisk.engine.ml.MLPredictor;
import com.dropoutrisk.engine.ml.ModelArtifactStore;
import com.dropoutrisk.engine.ml.ModelRegistry;
import com.dropoutrisk.engine.ml.PromotionGate;
import com.dropoutrisk.engine.rule.RuleEngine;
import com.dropoutrisk.engine.rule.ThresholdConfig;
import com.dropoutrisk.engine.rule.ThresholdConfigHolder;
import com.dropoutrisk.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.dropoutrisk.engine.ModelFixtures.artifact;
import static com.dropoutrisk.engine.ModelFixtures.constantMembers;
import static com.dropoutrisk.engine.StudentFixtures.student;
import static org.assertj.core.api.Assertions.*;

/**
 * Assessments running while models are promoted and thresholds reloaded must always see one
 * consistent model and one consistent threshold config.
 */
class ConcurrentAssessmentTest {

    private static final Instant NOW = Instant.parse("2024-09-01T08:00:00Z");
    private static final int PROMOTIONS = 40;
    private static final int READERS = 4;

    private final ThresholdConfig strict = ThresholdConfig.defaults();
    private final ThresholdConfig lenient = new ThresholdConfig("lenient-1", 40, 30, 45, 10, 1.0, 2);
    private final StudentRecords records = student("STU-C", 65, 50, 0.2);

    private static double probabilityOf(int release) {
        return 0.15 + (release % 8) * 0.1;
    }

    private static List<Tier> domainTiers(RiskAssessment assessment) {
        return List.of(assessment.attendanceTier(), assessment.academicTier(), assessment.financialTier(),
                assessment.ruleOverallTier());
    }

    @Test
    @DisplayName("Should never mix model or threshold versions while promotions and reloads run")
    void shouldNeverObserveTornSnapshots() throws Exception {
        ModelRegistry registry = new ModelRegistry(ModelArtifactStore.NONE);
        RiskAssessor assessor = new RiskAssessor(new FeatureExtractor(FeatureSchema.CURRENT, 10, 5),
                new RuleEngine(), new MLPredictor(registry), new RecommendationGenerator());
        ThresholdConfigHolder holder = new ThresholdConfigHolder(strict);

        // rule tiers expected under each threshold version, computed before any concurrency
        Map<String, List<Tier>> expectedTiers = new HashMap<>();
        expectedTiers.put(strict.version(), domainTiers(assessor.assess(records, strict, NOW)));
        expectedTiers.put(lenient.version(), domainTiers(assessor.assess(records, lenient, NOW)));
        assertThat(expectedTiers.get(strict.version())).isNotEqualTo(expectedTiers.get(lenient.version()));

        Map<String, Double> probabilityByVersion = new HashMap<>();
        for (int i = 1; i <= PROMOTIONS; i++) {
            probabilityByVersion.put("v" + i, probabilityOf(i));
        }

        ExecutorService executor = Executors.newFixedThreadPool(READERS + 1);
        Queue<RiskAssessment> results = new ConcurrentLinkedQueue<>();
        AtomicBoolean writing = new AtomicBoolean(true);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < READERS; r++) {
                readers.add(executor.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        results.add(assessor.assess(records, holder.current(), NOW));
                    }
                    return null;
                }));
            }

            Future<?> writer = executor.submit(() -> {
                start.await();
                try {
                    for (int i = 1; i <= PROMOTIONS; i++) {
                        String version = "v" + i;
                        registry.stage(artifact(version, 0.8, constantMembers(probabilityOf(i)),
                                LifecycleState.STAGED));
                        registry.markValidated(version);
                        registry.promote(version, PromotionGate.ALWAYS);
                        holder.publish(i % 2 == 0 ? strict : lenient);
                        Thread.sleep(1);
                    }
                } finally {
                    writing.set(false);
                }
                return null;
            });

            start.countDown();
            writer.get(30, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(results).isNotEmpty();
        for (RiskAssessment assessment : results) {
            assertThat(domainTiers(assessment)).isEqualTo(expectedTiers.get(assessment.thresholdVersion()));
            if (assessment.isRuleOnly()) {
                assertThat(assessment.dropoutProbability()).isNull();
            } else {
                assertThat(assessment.dropoutProbability())
                        .isCloseTo(probabilityByVersion.get(assessment.modelVersion()), within(1e-9));
                assertThat(assessment.finalOverallTier())
                        .isEqualTo(ReconciliationPolicy.reconcile(assessment.ruleOverallTier(), assessment.mlTier()));
            }
        }
        assertThat(registry.active()).map(a -> a.version()).contains("v" + PROMOTIONS);
    }
}
