package com.dropoutrisk.engine.ml;

/**
 * Receives lifecycle transitions after they have been applied.
 */
public interface ModelLifecycleListener {

    /**
     * @param from previous state, null when the artifact was just staged
     */
    void onTransition(ModelArtifact artifact, LifecycleState from, LifecycleState to);

    default void onPromotionRejected(ModelArtifact staged, String reason) {
    }
}
