package com.llmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single metric observation judged abnormal against its rolling baseline.
 *
 * <p>
 * Instances are immutable and final once produced: downstream collaborators
 * (incident submission, dashboards) must treat them as read-only records.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code timestamp},
 * {@code direction} and {@code severity} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;

    /** The raw value that triggered the anomaly. */
    private final double value;

    /** Signed number of standard deviations from the window mean. */
    private final double zScore;

    /** Signed deviation from the window mean, in percent. 0 when the mean is 0. */
    private final double deviationPercent;

    private final Direction direction;
    private final Severity severity;
    private final double baselineMean;
    private final double baselineStd;

    /** Drift-following EWMA reference at the time of detection. */
    private final double ewmaBaseline;

    private final Instant timestamp;

    private Anomaly(Builder builder) {
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.value = builder.value;
        this.zScore = builder.zScore;
        this.deviationPercent = builder.deviationPercent;
        this.direction = Objects.requireNonNull(builder.direction, "direction must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.baselineMean = builder.baselineMean;
        this.baselineStd = builder.baselineStd;
        this.ewmaBaseline = builder.ewmaBaseline;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String metricName;
        private double value;
        private double zScore;
        private double deviationPercent;
        private Direction direction;
        private Severity severity;
        private double baselineMean;
        private double baselineStd;
        private double ewmaBaseline;
        private Instant timestamp;

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder zScore(double zScore) {
            this.zScore = zScore;
            return this;
        }

        public Builder deviationPercent(double deviationPercent) {
            this.deviationPercent = deviationPercent;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder baselineMean(double baselineMean) {
            this.baselineMean = baselineMean;
            return this;
        }

        public Builder baselineStd(double baselineStd) {
            this.baselineStd = baselineStd;
            return this;
        }

        public Builder ewmaBaseline(double ewmaBaseline) {
            this.ewmaBaseline = ewmaBaseline;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public double getDeviationPercent() {
        return deviationPercent;
    }

    public Direction getDirection() {
        return direction;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStd() {
        return baselineStd;
    }

    public double getEwmaBaseline() {
        return ewmaBaseline;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(zScore, that.zScore) == 0
                && Objects.equals(metricName, that.metricName)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, value, zScore, timestamp);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "metricName='" + metricName + '\'' +
                ", value=" + value +
                ", zScore=" + String.format("%.2f", zScore) +
                ", deviationPercent=" + String.format("%.1f", deviationPercent) +
                ", direction=" + direction +
                ", severity=" + severity +
                ", timestamp=" + timestamp +
                '}';
    }
}
