package com.dropoutrisk.engine.ml;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for model artifacts and the active-version pointer.
 */
public interface ModelArtifactStore {

    /**
     * Store that keeps nothing; used when persistence is disabled.
     */
    ModelArtifactStore NONE = new ModelArtifactStore() {
        @Override
        public void save(ModelArtifact artifact) {
        }

        @Override
        public void saveActivePointer(String version) {
        }

        @Override
        public List<ModelArtifact> loadAll() {
            return List.of();
        }

        @Override
        public Optional<String> loadActivePointer() {
            return Optional.empty();
        }
    };

    void save(ModelArtifact artifact);

    void saveActivePointer(String version);

    List<ModelArtifact> loadAll();

    Optional<String> loadActivePointer();
}
