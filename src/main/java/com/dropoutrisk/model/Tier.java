package com.dropoutrisk.model;

/**
 * Risk tiers, declared in ascending order of severity.
 *
 * Severity order: RED > YELLOW > GREEN. Aggregation always picks the most
 * severe tier, there is no averaging between tiers.
 */
public enum Tier {
    GREEN,   // Safe
    YELLOW,  // Warning, monitor closely
    RED;     // Critical, intervention needed

    public boolean isMoreSevereThan(Tier other) {
        return compareTo(other) > 0;
    }

    /**
     * Returns this tier, raised to {@code floor} if {@code floor} is more severe.
     */
    public Tier atLeast(Tier floor) {
        return floor.isMoreSevereThan(this) ? floor : this;
    }

    public static Tier mostSevere(Tier first, Tier... others) {
        Tier worst = first;
        for (Tier tier : others) {
            worst = worst.atLeast(tier);
        }
        return worst;
    }
}
