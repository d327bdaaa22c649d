package com.dropoutrisk.engine.feature;

import com.dropoutrisk.model.RiskDomain;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Immutable feature vector for one student. Missing fields are stored as NaN
 * and are never confused with a real zero.
 */
public final class FeatureVector {

    private final String studentId;
    private final FeatureSchema schema;
    private final double[] values;

    private FeatureVector(String studentId, FeatureSchema schema, double[] values) {
        this.studentId = studentId;
        this.schema = schema;
        this.values = values;
    }

    public static Builder builder(String studentId, FeatureSchema schema) {
        return new Builder(studentId, schema);
    }

    public String studentId() {
        return studentId;
    }

    public FeatureSchema schema() {
        return schema;
    }

    public String schemaVersion() {
        return schema.version();
    }

    public boolean isMissing(Feature feature) {
        int index = schema.indexOf(feature);
        return index < 0 || Double.isNaN(values[index]);
    }

    public OptionalDouble value(Feature feature) {
        return isMissing(feature) ? OptionalDouble.empty() : OptionalDouble.of(values[schema.indexOf(feature)]);
    }

    /**
     * A domain is missing when every schema feature belonging to it is missing.
     */
    public boolean isDomainMissing(RiskDomain domain) {
        return schema.features().stream()
                .filter(f -> f.domain() == domain)
                .allMatch(this::isMissing);
    }

    /**
     * Values in schema order, NaN where missing. Returns a copy.
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector other)) {
            return false;
        }
        return studentId.equals(other.studentId)
                && schema.equals(other.schema)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * studentId.hashCode() + schema.hashCode()) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector{studentId=" + studentId + ", schema=" + schema.version()
                + ", values=" + Arrays.toString(values) + "}";
    }

    public static final class Builder {

        private final String studentId;
        private final FeatureSchema schema;
        private final double[] values;

        private Builder(String studentId, FeatureSchema schema) {
            if (studentId == null || studentId.isBlank()) {
                throw new IllegalArgumentException("Student ID cannot be null or empty");
            }
            this.studentId = studentId;
            this.schema = schema;
            this.values = new double[schema.dimension()];
            Arrays.fill(values, Double.NaN);
        }

        public Builder set(Feature feature, double value) {
            int index = schema.indexOf(feature);
            if (index < 0) {
                throw new IllegalArgumentException(
                        "Feature " + feature.fieldName() + " is not part of schema " + schema.version());
            }
            values[index] = value;
            return this;
        }

        public Builder missing(Feature feature) {
            return set(feature, Double.NaN);
        }

        public FeatureVector build() {
            return new FeatureVector(studentId, schema, values.clone());
        }
    }
}
