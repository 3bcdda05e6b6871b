package com.llmsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of observing every metric of one logical request.
 *
 * @since 1.0.0
 */
public final class BatchResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final BatchResult EMPTY = new BatchResult(List.of(), null);

    private final ArrayList<Anomaly> anomalies;
    private final Pattern pattern;

    private BatchResult(List<Anomaly> anomalies, Pattern pattern) {
        this.anomalies = new ArrayList<>(anomalies);
        this.pattern = pattern;
    }

    public static BatchResult empty() {
        return EMPTY;
    }

    /**
     * @param anomalies anomalies raised within the batch, in observation order
     * @param pattern   correlated pattern, or {@code null}
     */
    public static BatchResult of(List<Anomaly> anomalies, Pattern pattern) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        if (anomalies.isEmpty() && pattern == null) {
            return EMPTY;
        }
        return new BatchResult(anomalies, pattern);
    }

    /**
     * @return unmodifiable list of anomalies raised within the batch
     */
    public List<Anomaly> getAnomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    public Optional<Pattern> getPattern() {
        return Optional.ofNullable(pattern);
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }

    /**
     * @return the most urgent severity in the batch, if any anomaly was raised
     */
    public Optional<Severity> getMaxSeverity() {
        if (pattern != null) {
            return Optional.of(pattern.getSeverity());
        }
        return anomalies.stream()
                .map(Anomaly::getSeverity)
                .reduce(Severity::max);
    }

    @Override
    public String toString() {
        return "BatchResult{anomalies=" + anomalies + ", pattern=" + pattern + '}';
    }
}
