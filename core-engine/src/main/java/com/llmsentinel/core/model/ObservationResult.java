package com.llmsentinel.core.model;

import java.util.Optional;

/**
 * Outcome of observing a single metric value.
 *
 * <p>
 * Both parts are optional: insufficient history and zero-variance history
 * are valid "no verdict" outcomes rather than failures.
 * </p>
 */
public final class ObservationResult {

    private static final ObservationResult NONE = new ObservationResult(null, null);

    private final Anomaly anomaly;
    private final Pattern pattern;

    private ObservationResult(Anomaly anomaly, Pattern pattern) {
        this.anomaly = anomaly;
        this.pattern = pattern;
    }

    public static ObservationResult none() {
        return NONE;
    }

    public static ObservationResult of(Anomaly anomaly, Pattern pattern) {
        if (anomaly == null && pattern == null) {
            return NONE;
        }
        return new ObservationResult(anomaly, pattern);
    }

    public Optional<Anomaly> getAnomaly() {
        return Optional.ofNullable(anomaly);
    }

    public Optional<Pattern> getPattern() {
        return Optional.ofNullable(pattern);
    }

    @Override
    public String toString() {
        return "ObservationResult{anomaly=" + anomaly + ", pattern=" + pattern + '}';
    }
}
