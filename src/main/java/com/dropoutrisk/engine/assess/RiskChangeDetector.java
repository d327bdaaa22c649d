package com.dropoutrisk.engine.assess;

import com.dropoutrisk.event.RiskTierChanged;
import com.dropoutrisk.model.Tier;

import java.util.Optional;

/**
 * Compares a new assessment with the student's previous final tier.
 * A student with no history is measured against a GREEN baseline.
 */
public class RiskChangeDetector {

    private static final Tier BASELINE = Tier.GREEN;

    /**
     * @param previousFinalTier final tier of the previous assessment, null for a first assessment
     */
    public Optional<RiskTierChanged> detect(Tier previousFinalTier, RiskAssessment assessment) {
        Tier before = previousFinalTier == null ? BASELINE : previousFinalTier;
        if (before == assessment.finalOverallTier()) {
            return Optional.empty();
        }
        return Optional.of(new RiskTierChanged(
                assessment.studentId(),
                previousFinalTier,
                assessment.finalOverallTier(),
                assessment,
                assessment.assessedAt()));
    }
}
