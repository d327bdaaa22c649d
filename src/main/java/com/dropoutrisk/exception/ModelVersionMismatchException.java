package com.dropoutrisk.exception;

/**
 * Thrown when a feature vector was built against a different feature schema
 * than the model artifact expects. Fatal for the single request only.
 */
public class ModelVersionMismatchException extends RiskEngineException {

    private final String vectorSchemaVersion;
    private final String modelSchemaVersion;

    public ModelVersionMismatchException(String modelVersion, String vectorSchemaVersion, String modelSchemaVersion) {
        super(String.format("Feature schema %s does not match schema %s of model %s",
                vectorSchemaVersion, modelSchemaVersion, modelVersion));
        this.vectorSchemaVersion = vectorSchemaVersion;
        this.modelSchemaVersion = modelSchemaVersion;
    }

    public String getVectorSchemaVersion() {
        return vectorSchemaVersion;
    }

    public String getModelSchemaVersion() {
        return modelSchemaVersion;
    }
}
