package com.dropoutrisk.engine.assess;

import com.dropoutrisk.engine.feature.ExtractionWindow;
import com.dropoutrisk.engine.feature.Feature;
import com.dropoutrisk.engine.feature.FeatureExtractor;
import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.engine.feature.StudentRecords;
import com.dropoutrisk.engine.ml.MLPredictor;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.Prediction;
import com.dropoutrisk.engine.rule.RuleEngine;
import com.dropoutrisk.engine.rule.RuleEvaluation;
import com.dropoutrisk.engine.rule.ThresholdConfig;
import com.dropoutrisk.exception.RiskEngineException;
import com.dropoutrisk.model.Tier;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Orchestrates one assessment: extract features, apply rules, score with the model, reconcile.
 *
 * PURE BY CONSTRUCTION:
 * =====================
 * - thresholds, model snapshot and assessment time are all inputs
 * - no storage writes, no events, no notifications; the caller owns every side effect
 * - identical inputs give an identical {@link RiskAssessment}
 *
 * This is what makes a retry safe: re-running an assessment cannot duplicate anything.
 */
@Slf4j
public class RiskAssessor {

    private final FeatureExtractor extractor;
    private final RuleEngine ruleEngine;
    private final MLPredictor predictor;
    private final RecommendationGenerator recommendationGenerator;

    public RiskAssessor(FeatureExtractor extractor, RuleEngine ruleEngine, MLPredictor predictor,
                        RecommendationGenerator recommendationGenerator) {
        this.extractor = extractor;
        this.ruleEngine = ruleEngine;
        this.predictor = predictor;
        this.recommendationGenerator = recommendationGenerator;
    }

    /**
     * Assesses one student against the model active right now.
     */
    public RiskAssessment assess(StudentRecords records, ThresholdConfig thresholds, Instant assessedAt) {
        return assess(records, ExtractionWindow.unbounded(), thresholds, predictor.activeModel(), assessedAt);
    }

    /**
     * Assesses one student against an explicit model snapshot (empty for a rule-only verdict).
     */
    public RiskAssessment assess(StudentRecords records, ExtractionWindow window, ThresholdConfig thresholds,
                                 Optional<ModelArtifact> model, Instant assessedAt) {
        FeatureVector vector = extractor.extract(records, window);
        RuleEvaluation rules = ruleEngine.evaluate(vector, thresholds);
        Prediction prediction = model.map(artifact -> predictor.predict(artifact, vector)).orElse(null);

        Tier mlTier = prediction == null ? null : ReconciliationPolicy.mlTier(prediction.probability());
        Tier finalTier = ReconciliationPolicy.reconcile(rules.overallTier(), mlTier);

        RiskAssessment assessment = new RiskAssessment(
                records.studentId(),
                assessedAt,
                rules.attendanceTier(),
                rules.academicTier(),
                rules.financialTier(),
                rules.overallTier(),
                prediction == null ? null : prediction.probability(),
                prediction == null ? null : prediction.confidence(),
                mlTier,
                finalTier,
                prediction == null ? null : prediction.modelVersion(),
                thresholds.version(),
                vector.schemaVersion(),
                valueOrNull(vector, Feature.ATTENDANCE_PERCENTAGE),
                valueOrNull(vector, Feature.AVERAGE_SCORE),
                valueOrNull(vector, Feature.OVERDUE_FEES_RATIO),
                prediction == null ? Map.of() : prediction.memberProbabilities(),
                recommendationGenerator.generate(vector, rules, prediction));

        log.debug("Assessed student {}: rule={} ml={} final={}",
                records.studentId(), rules.overallTier(), mlTier, finalTier);
        return assessment;
    }

    /**
     * Assesses many students against one model snapshot. A student that cannot be assessed is
     * reported in the failures and the rest of the batch carries on.
     */
    public BatchAssessmentResult assessBatch(List<StudentRecords> students, ThresholdConfig thresholds,
                                             Instant assessedAt) {
        Optional<ModelArtifact> model = predictor.activeModel();
        List<RiskAssessment> assessments = new ArrayList<>();
        List<AssessmentFailure> failures = new ArrayList<>();

        for (StudentRecords records : students) {
            try {
                assessments.add(assess(records, ExtractionWindow.unbounded(), thresholds, model, assessedAt));
            } catch (RiskEngineException e) {
                log.warn("Could not assess student {}: {}", records.studentId(), e.getMessage());
                failures.add(new AssessmentFailure(records.studentId(), e.getClass().getSimpleName(), e.getMessage()));
            }
        }

        log.info("Batch assessment finished: {} assessed, {} failed, model {}, thresholds {}",
                assessments.size(), failures.size(),
                model.map(ModelArtifact::version).orElse("none"), thresholds.version());
        return new BatchAssessmentResult(assessments, failures);
    }

    private static Double valueOrNull(FeatureVector vector, Feature feature) {
        OptionalDouble value = vector.value(feature);
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
