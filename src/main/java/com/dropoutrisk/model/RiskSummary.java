package com.dropoutrisk.model;

import java.util.Map;

/**
 * Counts of stored assessments by final tier.
 *
 * @param recentAssessments assessments made within the recent window (30 days)
 */
public record RiskSummary(
    long totalAssessments,
    long greenCount,
    long yellowCount,
    long redCount,
    long recentAssessments,
    Map<Tier, Long> riskDistribution
) {
}
