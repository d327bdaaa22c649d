package com.dropoutrisk.engine.assess;

import com.dropoutrisk.model.Tier;

/**
 * Escalate-only merge of the rule verdict and the model verdict.
 *
 * The model can raise the final tier above the rule tier but never lower it:
 * a favorable probability does not hide a visible rule-based deficiency.
 */
public final class ReconciliationPolicy {

    public static final double RED_PROBABILITY = 0.7;
    public static final double YELLOW_PROBABILITY = 0.4;

    private ReconciliationPolicy() {
    }

    public static Tier mlTier(double dropoutProbability) {
        if (dropoutProbability >= RED_PROBABILITY) {
            return Tier.RED;
        }
        return dropoutProbability >= YELLOW_PROBABILITY ? Tier.YELLOW : Tier.GREEN;
    }

    /**
     * @param mlTier null when no model took part
     */
    public static Tier reconcile(Tier ruleTier, Tier mlTier) {
        return mlTier == null ? ruleTier : Tier.mostSevere(ruleTier, mlTier);
    }
}
