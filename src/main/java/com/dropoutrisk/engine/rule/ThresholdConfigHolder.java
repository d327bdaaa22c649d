package com.dropoutrisk.engine.rule;

import com.dropoutrisk.exception.ThresholdConfigException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published {@link ThresholdConfig}.
 *
 * Readers take a snapshot with {@link #current()} and pass it explicitly into each
 * assessment. A reload swaps the reference in one step; a config that fails validation
 * never reaches this class, so the previous one keeps serving.
 *
 * A version id names exactly one set of bands for the life of the process: publishing
 * different values under a version that was already published is rejected.
 */
@Slf4j
public class ThresholdConfigHolder {

    private final AtomicReference<ThresholdConfig> current;
    private final Map<String, ThresholdConfig> published = new HashMap<>();

    public ThresholdConfigHolder(ThresholdConfig initial) {
        if (initial == null) {
            throw new IllegalArgumentException("Threshold config cannot be null");
        }
        this.current = new AtomicReference<>(initial);
        published.put(initial.version(), initial);
        log.info("Loaded threshold config {}", initial);
    }

    public ThresholdConfig current() {
        return current.get();
    }

    /**
     * Publishes a new configuration and returns the one it replaced. Re-publishing an
     * identical config is allowed.
     *
     * @throws ThresholdConfigException if the version was already published with other values
     */
    public synchronized ThresholdConfig publish(ThresholdConfig next) {
        if (next == null) {
            throw new IllegalArgumentException("Threshold config cannot be null");
        }
        ThresholdConfig known = published.get(next.version());
        if (known != null && !known.equals(next)) {
            throw new ThresholdConfigException(String.format(
                    "Threshold config version %s is already published with different values; "
                            + "changed bands need a new version", next.version()));
        }
        published.put(next.version(), next);
        ThresholdConfig previous = current.getAndSet(next);
        log.info("Threshold config reloaded: {} -> {}", previous.version(), next.version());
        return previous;
    }
}
