package com.llmsentinel.core.model;

import java.util.Objects;

/**
 * Read-only view of one metric's rolling statistics, as reported to the
 * health / status collaborator.
 */
public final class MetricStats {

    private final String metricName;
    private final long count;
    private final int size;
    private final double mean;
    private final double std;
    private final double ewmaBaseline;
    private final boolean valid;

    public MetricStats(String metricName, long count, int size, double mean, double std,
            double ewmaBaseline, boolean valid) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.count = count;
        this.size = size;
        this.mean = mean;
        this.std = std;
        this.ewmaBaseline = ewmaBaseline;
        this.valid = valid;
    }

    public String getMetricName() {
        return metricName;
    }

    /** Total observations since the window was created. */
    public long getCount() {
        return count;
    }

    /** Values currently retained in the window. */
    public int getSize() {
        return size;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getEwmaBaseline() {
        return ewmaBaseline;
    }

    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return "MetricStats{" +
                "metricName='" + metricName + '\'' +
                ", count=" + count +
                ", size=" + size +
                ", mean=" + mean +
                ", std=" + std +
                ", ewmaBaseline=" + ewmaBaseline +
                ", valid=" + valid +
                '}';
    }
}
