package com.llmsentinel.core.baseline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Captured per-metric history of a detection registry.
 *
 * <p>
 * The engine keeps no state across restarts on its own; a collaborator may
 * capture a snapshot, store it (see {@link BaselineSnapshotStore}) and
 * restore it into a fresh registry so detection does not start cold.
 * </p>
 *
 * <p>
 * The window settings are recorded for information; a registry restoring a
 * snapshot always applies its own settings.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaselineSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private Instant createdAt;
    private int windowCapacity;
    private int minPoints;
    private double ewmaAlpha;
    private Map<String, MetricHistory> metrics = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public BaselineSnapshot() {
    }

    public BaselineSnapshot(Instant createdAt, int windowCapacity, int minPoints, double ewmaAlpha,
            Map<String, MetricHistory> metrics) {
        this.createdAt = createdAt;
        this.windowCapacity = windowCapacity;
        this.minPoints = minPoints;
        this.ewmaAlpha = ewmaAlpha;
        setMetrics(metrics);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public int getWindowCapacity() {
        return windowCapacity;
    }

    public void setWindowCapacity(int windowCapacity) {
        this.windowCapacity = windowCapacity;
    }

    public int getMinPoints() {
        return minPoints;
    }

    public void setMinPoints(int minPoints) {
        this.minPoints = minPoints;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    /**
     * @return unmodifiable map of metric name to captured history
     */
    public Map<String, MetricHistory> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public void setMetrics(Map<String, MetricHistory> metrics) {
        this.metrics = metrics != null ? new LinkedHashMap<>(metrics) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{" +
                "createdAt=" + createdAt +
                ", windowCapacity=" + windowCapacity +
                ", metrics=" + metrics.keySet() +
                '}';
    }

    /**
     * History of one metric: retained values (oldest first), total
     * observation count and EWMA baseline.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetricHistory implements Serializable {

        private static final long serialVersionUID = 1L;

        private long count;
        private double ewmaBaseline;
        private double[] values = new double[0];

        public MetricHistory() {
        }

        public MetricHistory(long count, double ewmaBaseline, double[] values) {
            this.count = count;
            this.ewmaBaseline = ewmaBaseline;
            setValues(values);
        }

        public long getCount() {
            return count;
        }

        public void setCount(long count) {
            this.count = count;
        }

        public double getEwmaBaseline() {
            return ewmaBaseline;
        }

        public void setEwmaBaseline(double ewmaBaseline) {
            this.ewmaBaseline = ewmaBaseline;
        }

        /**
         * @return copy of the retained values, oldest first
         */
        public double[] getValues() {
            return values.clone();
        }

        public void setValues(double[] values) {
            this.values = values != null ? values.clone() : new double[0];
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof MetricHistory that))
                return false;
            return count == that.count
                    && Double.compare(ewmaBaseline, that.ewmaBaseline) == 0
                    && Arrays.equals(values, that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(count, ewmaBaseline) * 31 + Arrays.hashCode(values);
        }
    }
}
