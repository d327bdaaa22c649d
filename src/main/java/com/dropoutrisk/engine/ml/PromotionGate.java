package com.dropoutrisk.engine.ml;

import java.util.Optional;

/**
 * Check applied while the registry holds its promotion lock. Throws to veto.
 */
@FunctionalInterface
public interface PromotionGate {

    PromotionGate ALWAYS = (candidate, active) -> { };

    void check(ModelArtifact candidate, Optional<ModelArtifact> active);
}
