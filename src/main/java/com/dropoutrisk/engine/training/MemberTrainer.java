package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.ml.EnsembleMember;

/**
 * Fits one kind of ensemble member on standardized training data.
 */
public interface MemberTrainer {

    /**
     * @param x      standardized rows, no missing values
     * @param labels 1 for dropout, 0 otherwise
     * @param seed   source of all randomness, so identical inputs give identical members
     */
    EnsembleMember fit(double[][] x, int[] labels, long seed);
}
