package com.dropoutrisk.engine.rule;

import com.dropoutrisk.model.Tier;

/**
 * Per-domain rule tiers plus their aggregate.
 */
public record RuleEvaluation(
    Tier attendanceTier,
    Tier academicTier,
    Tier financialTier,
    Tier overallTier,
    String thresholdVersion
) {
}
