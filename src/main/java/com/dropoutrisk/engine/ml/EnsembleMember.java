package com.dropoutrisk.engine.ml;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A trained classifier inside a model artifact.
 *
 * Members receive an imputed, standardized vector in schema order and return the
 * probability of the positive (dropout) class. The predictor averages members
 * without knowing their concrete type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LogisticRegressionClassifier.class, name = LogisticRegressionClassifier.NAME),
        @JsonSubTypes.Type(value = RandomForestClassifier.class, name = RandomForestClassifier.NAME)
})
public interface EnsembleMember {

    String name();

    double predictProba(double[] standardized);
}
