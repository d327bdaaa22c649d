package com.dropoutrisk.engine.assess;

import com.dropoutrisk.model.Tier;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable verdict for one student at one point in time.
 *
 * The ML fields ({@code dropoutProbability}, {@code confidence}, {@code mlTier},
 * {@code modelVersion}) are null when no model was active; the verdict is then rule-only.
 * Feature snapshot fields are null when the domain had no data.
 * Corrections are new assessments, never edits of this one.
 */
public record RiskAssessment(
    String studentId,
    Instant assessedAt,
    Tier attendanceTier,
    Tier academicTier,
    Tier financialTier,
    Tier ruleOverallTier,
    Double dropoutProbability,
    Double confidence,
    Tier mlTier,
    Tier finalOverallTier,
    String modelVersion,
    String thresholdVersion,
    String featureSchemaVersion,
    Double attendancePercentage,
    Double averageScore,
    Double overdueFeesRatio,
    Map<String, Double> memberProbabilities,
    List<String> recommendations
) {
    public RiskAssessment {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("Student ID cannot be null or empty");
        }
        if (assessedAt == null) {
            throw new IllegalArgumentException("Assessment time cannot be null");
        }
        if (ruleOverallTier == null || finalOverallTier == null) {
            throw new IllegalArgumentException("Rule and final tiers cannot be null");
        }
        if (ruleOverallTier.isMoreSevereThan(finalOverallTier)) {
            throw new IllegalArgumentException("Final tier " + finalOverallTier
                    + " cannot be less severe than rule tier " + ruleOverallTier);
        }
        memberProbabilities = memberProbabilities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(memberProbabilities));
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    @JsonIgnore
    public boolean isRuleOnly() {
        return modelVersion == null;
    }
}
