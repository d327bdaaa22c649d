package com.dropoutrisk.engine.ml;

/**
 * Model artifact lifecycle: STAGED -> VALIDATED -> ACTIVE -> RETIRED.
 */
public enum LifecycleState {
    STAGED,
    VALIDATED,
    ACTIVE,
    RETIRED;

    public boolean canTransitionTo(LifecycleState next) {
        return switch (this) {
            case STAGED -> next == VALIDATED;
            case VALIDATED -> next == ACTIVE;
            case ACTIVE -> next == RETIRED;
            case RETIRED -> false;
        };
    }
}
