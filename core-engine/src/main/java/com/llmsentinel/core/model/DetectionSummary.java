package com.llmsentinel.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health / status numbers of a detection registry at one point in time.
 *
 * @since 1.0.0
 */
public final class DetectionSummary {

    private final long totalDatapoints;
    private final long totalAnomalies;
    private final long totalPatterns;
    private final int recentAnomalies;
    private final Map<String, MetricStats> perMetricStats;

    public DetectionSummary(long totalDatapoints, long totalAnomalies, long totalPatterns,
            int recentAnomalies, Map<String, MetricStats> perMetricStats) {
        this.totalDatapoints = totalDatapoints;
        this.totalAnomalies = totalAnomalies;
        this.totalPatterns = totalPatterns;
        this.recentAnomalies = recentAnomalies;
        this.perMetricStats = Collections.unmodifiableMap(new TreeMap<>(perMetricStats));
    }

    public long getTotalDatapoints() {
        return totalDatapoints;
    }

    public long getTotalAnomalies() {
        return totalAnomalies;
    }

    public long getTotalPatterns() {
        return totalPatterns;
    }

    public int getMetricsTracked() {
        return perMetricStats.size();
    }

    /** Anomalies currently held in the bounded recent-anomaly buffer. */
    public int getRecentAnomalies() {
        return recentAnomalies;
    }

    /**
     * @return unmodifiable map of metric name to statistics, sorted by name
     */
    public Map<String, MetricStats> getPerMetricStats() {
        return perMetricStats;
    }

    @Override
    public String toString() {
        return "DetectionSummary{" +
                "totalDatapoints=" + totalDatapoints +
                ", totalAnomalies=" + totalAnomalies +
                ", totalPatterns=" + totalPatterns +
                ", metricsTracked=" + perMetricStats.size() +
                ", recentAnomalies=" + recentAnomalies +
                '}';
    }
}
