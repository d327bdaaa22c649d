package com.dropoutrisk.engine.ml;

import com.dropoutrisk.exception.ModelLifecycleException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns every known model artifact and the reference to the single ACTIVE one.
 *
 * READ PATH:
 * ==========
 * {@link #active()} is a single volatile read of an immutable artifact. Assessments never
 * take a lock and never see a half-promoted model.
 *
 * WRITE PATH:
 * ===========
 * Staging, validation and promotion are serialized on a private monitor. Promotion
 * persists the new states first and the active pointer last, then swaps the ACTIVE
 * reference. Listeners, including rejection listeners, are notified after the lock is
 * released.
 */
@Slf4j
public class ModelRegistry {

    private final Map<String, ModelArtifact> artifacts = new ConcurrentHashMap<>();
    private final AtomicReference<ModelArtifact> active = new AtomicReference<>();
    private final List<ModelLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final ModelArtifactStore store;
    private final Object writeLock = new Object();

    public ModelRegistry(ModelArtifactStore store) {
        this.store = store;
    }

    public void addListener(ModelLifecycleListener listener) {
        listeners.add(listener);
    }

    public Optional<ModelArtifact> active() {
        return Optional.ofNullable(active.get());
    }

    public Optional<ModelArtifact> find(String version) {
        return Optional.ofNullable(artifacts.get(version));
    }

    /**
     * All artifacts ordered by version sequence.
     */
    public List<ModelArtifact> all() {
        List<ModelArtifact> sorted = new ArrayList<>(artifacts.values());
        sorted.sort(Comparator.comparingLong(a -> sequenceOf(a.version())));
        return sorted;
    }

    /**
     * Next free version id of the form {@code v<n>}.
     */
    public String nextVersion() {
        synchronized (writeLock) {
            long max = artifacts.keySet().stream().mapToLong(ModelRegistry::sequenceOf).max().orElse(0L);
            return "v" + (max + 1);
        }
    }

    /**
     * Loads previously stored artifacts without emitting lifecycle events.
     *
     * The stored pointer decides which artifact is ACTIVE. A promotion interrupted between its
     * writes can leave stored states that disagree with the pointer; they are repaired here:
     * the pointed-to artifact becomes ACTIVE and any other artifact stored as ACTIVE falls back
     * to VALIDATED, so it can be promoted again.
     */
    public void restore() {
        synchronized (writeLock) {
            Optional<String> pointer = store.loadActivePointer();
            for (ModelArtifact artifact : store.loadAll()) {
                artifacts.put(artifact.version(), artifact);
            }
            String activeVersion = pointer.filter(artifacts::containsKey).orElse(null);
            if (pointer.isPresent() && activeVersion == null) {
                log.error("Stored active pointer names unknown model {}, no model is active", pointer.get());
            }

            for (ModelArtifact artifact : List.copyOf(artifacts.values())) {
                boolean pointedTo = artifact.version().equals(activeVersion);
                if (pointedTo && artifact.state() != LifecycleState.ACTIVE) {
                    repair(artifact, LifecycleState.ACTIVE);
                } else if (!pointedTo && artifact.state() == LifecycleState.ACTIVE) {
                    repair(artifact, LifecycleState.VALIDATED);
                }
            }

            if (activeVersion != null) {
                ModelArtifact restored = artifacts.get(activeVersion);
                active.set(restored);
                log.info("Restored active model {} (schema {}, holdout metric {})", restored.version(),
                        restored.featureSchemaVersion(), restored.holdoutMetric());
            }
        }
    }

    private void repair(ModelArtifact artifact, LifecycleState state) {
        log.warn("Stored model {} is {} but the active pointer disagrees, restoring it as {}",
                artifact.version(), artifact.state(), state);
        ModelArtifact repaired = artifact.withState(state);
        store.save(repaired);
        artifacts.put(repaired.version(), repaired);
    }

    public ModelArtifact stage(ModelArtifact artifact) {
        if (artifact.state() != LifecycleState.STAGED) {
            throw new ModelLifecycleException("Only STAGED artifacts can be registered, got " + artifact.state());
        }
        synchronized (writeLock) {
            if (artifacts.containsKey(artifact.version())) {
                throw new ModelLifecycleException("Model version already registered: " + artifact.version());
            }
            store.save(artifact);
            artifacts.put(artifact.version(), artifact);
        }
        log.info("Staged model {}", artifact.version());
        notifyTransition(artifact, null, LifecycleState.STAGED);
        return artifact;
    }

    public ModelArtifact markValidated(String version) {
        ModelArtifact validated;
        synchronized (writeLock) {
            ModelArtifact current = require(version);
            checkTransition(current, LifecycleState.VALIDATED);
            validated = current.withState(LifecycleState.VALIDATED);
            store.save(validated);
            artifacts.put(version, validated);
        }
        log.info("Validated model {}", version);
        notifyTransition(validated, LifecycleState.STAGED, LifecycleState.VALIDATED);
        return validated;
    }

    /**
     * Promotes a VALIDATED artifact to ACTIVE if the gate allows it; the previous ACTIVE is retired.
     * If the gate throws, nothing changes and listeners hear about the rejection.
     */
    public ModelArtifact promote(String version, PromotionGate gate) {
        return promote(version, gate, false);
    }

    /**
     * Checks a STAGED artifact against the gate and, if it passes, validates and promotes it in
     * one step. A rejected artifact stays STAGED.
     */
    public ModelArtifact validateAndPromote(String version, PromotionGate gate) {
        return promote(version, gate, true);
    }

    private ModelArtifact promote(String version, PromotionGate gate, boolean fromStaged) {
        ModelArtifact candidate;
        ModelArtifact promoted = null;
        ModelArtifact retired = null;
        RuntimeException rejection = null;
        synchronized (writeLock) {
            candidate = require(version);
            checkTransition(candidate, fromStaged ? LifecycleState.VALIDATED : LifecycleState.ACTIVE);
            ModelArtifact previous = active.get();
            try {
                gate.check(candidate, Optional.ofNullable(previous));
            } catch (RuntimeException e) {
                rejection = e;
            }

            if (rejection == null) {
                if (fromStaged) {
                    ModelArtifact validated = candidate.withState(LifecycleState.VALIDATED);
                    store.save(validated);
                    artifacts.put(version, validated);
                }
                promoted = candidate.withState(LifecycleState.ACTIVE);
                store.save(promoted);
                if (previous != null) {
                    retired = previous.withState(LifecycleState.RETIRED);
                    store.save(retired);
                }
                // the pointer is written last; restore() repairs states left by a partial promotion
                store.saveActivePointer(version);

                artifacts.put(version, promoted);
                active.set(promoted);
                if (retired != null) {
                    artifacts.put(retired.version(), retired);
                }
            }
        }

        if (rejection != null) {
            log.error("Promotion of model {} rejected: {}", candidate.version(), rejection.getMessage());
            notifyRejection(candidate, rejection.getMessage());
            throw rejection;
        }

        log.info("Model {} is now ACTIVE{}", version,
                retired == null ? "" : " (retired " + retired.version() + ")");
        if (fromStaged) {
            notifyTransition(promoted.withState(LifecycleState.VALIDATED),
                    LifecycleState.STAGED, LifecycleState.VALIDATED);
        }
        notifyTransition(promoted, LifecycleState.VALIDATED, LifecycleState.ACTIVE);
        if (retired != null) {
            notifyTransition(retired, LifecycleState.ACTIVE, LifecycleState.RETIRED);
        }
        return promoted;
    }

    private void notifyRejection(ModelArtifact candidate, String reason) {
        listeners.forEach(l -> safely(() -> l.onPromotionRejected(candidate, reason)));
    }

    private ModelArtifact require(String version) {
        ModelArtifact artifact = artifacts.get(version);
        if (artifact == null) {
            throw new ModelLifecycleException("Unknown model version: " + version);
        }
        return artifact;
    }

    private static void checkTransition(ModelArtifact artifact, LifecycleState next) {
        if (!artifact.state().canTransitionTo(next)) {
            throw new ModelLifecycleException(String.format("Model %s cannot move from %s to %s",
                    artifact.version(), artifact.state(), next));
        }
    }

    private void notifyTransition(ModelArtifact artifact, LifecycleState from, LifecycleState to) {
        listeners.forEach(l -> safely(() -> l.onTransition(artifact, from, to)));
    }

    private static void safely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            // the transition already happened; a broken listener must not undo it
            log.error("Model lifecycle listener failed", e);
        }
    }

    static long sequenceOf(String version) {
        if (version.length() > 1 && version.charAt(0) == 'v') {
            try {
                return Long.parseLong(version.substring(1));
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }
}
