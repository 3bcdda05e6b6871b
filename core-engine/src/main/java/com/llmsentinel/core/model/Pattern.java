package com.llmsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named classification of two or more correlated anomalies.
 *
 * <p>
 * The pattern id is either the id of the {@link PatternRule} that matched or
 * {@value #UNCLASSIFIED} when several anomalies co-occurred without matching
 * any rule. Severity is always the most urgent severity among the members.
 * </p>
 *
 * @since 1.0.0
 */
public final class Pattern implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Pattern id used when no rule matches a correlated group. */
    public static final String UNCLASSIFIED = "unclassified";

    private final String patternId;
    private final String description;

    /** Metric names of the winning rule that were present. Empty for unclassified. */
    private final ArrayList<String> matchedMetrics;

    private final ArrayList<Anomaly> memberAnomalies;
    private final Severity severity;
    private final Instant windowStart;
    private final Instant windowEnd;

    private Pattern(Builder builder) {
        this.patternId = Objects.requireNonNull(builder.patternId, "patternId must not be null");
        this.description = builder.description;
        this.matchedMetrics = new ArrayList<>(builder.matchedMetrics);
        if (builder.memberAnomalies.isEmpty()) {
            throw new IllegalArgumentException("A pattern requires at least one member anomaly");
        }
        this.memberAnomalies = new ArrayList<>(builder.memberAnomalies);

        Severity max = Severity.SEV_3;
        Instant start = null;
        Instant end = null;
        for (Anomaly a : memberAnomalies) {
            max = Severity.max(max, a.getSeverity());
            if (start == null || a.getTimestamp().isBefore(start)) {
                start = a.getTimestamp();
            }
            if (end == null || a.getTimestamp().isAfter(end)) {
                end = a.getTimestamp();
            }
        }
        this.severity = max;
        this.windowStart = start;
        this.windowEnd = end;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Pattern}. Severity and the correlation time
     * span are derived from the member anomalies.
     */
    public static class Builder {
        private String patternId;
        private String description;
        private final List<String> matchedMetrics = new ArrayList<>();
        private final List<Anomaly> memberAnomalies = new ArrayList<>();

        public Builder patternId(String patternId) {
            this.patternId = patternId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder matchedMetrics(List<String> metrics) {
            this.matchedMetrics.addAll(metrics);
            return this;
        }

        public Builder memberAnomalies(List<Anomaly> anomalies) {
            this.memberAnomalies.addAll(anomalies);
            return this;
        }

        /**
         * @throws NullPointerException     if {@code patternId} is missing
         * @throws IllegalArgumentException if there are no member anomalies
         */
        public Pattern build() {
            return new Pattern(this);
        }
    }

    public String getPatternId() {
        return patternId;
    }

    public String getDescription() {
        return description;
    }

    public boolean isUnclassified() {
        return UNCLASSIFIED.equals(patternId);
    }

    public List<String> getMatchedMetrics() {
        return Collections.unmodifiableList(matchedMetrics);
    }

    public List<Anomaly> getMemberAnomalies() {
        return Collections.unmodifiableList(memberAnomalies);
    }

    public Severity getSeverity() {
        return severity;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pattern that))
            return false;
        return Objects.equals(patternId, that.patternId)
                && Objects.equals(memberAnomalies, that.memberAnomalies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patternId, memberAnomalies);
    }

    @Override
    public String toString() {
        return "Pattern{" +
                "patternId='" + patternId + '\'' +
                ", severity=" + severity +
                ", members=" + memberAnomalies.size() +
                ", windowStart=" + windowStart +
                ", windowEnd=" + windowEnd +
                '}';
    }
}
