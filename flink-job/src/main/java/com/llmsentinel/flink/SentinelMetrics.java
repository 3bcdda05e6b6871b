package com.llmsentinel.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Flink metrics of the detection operator, exposed through the reporters
 * configured on the cluster (e.g. Prometheus).
 *
 * <ul>
 *   <li>{@code datapoints_observed_total}: metric values fed to the engine</li>
 *   <li>{@code anomalies_detected_total}: anomalies raised</li>
 *   <li>{@code patterns_detected_total}: correlated patterns raised</li>
 *   <li>{@code records_rejected_total}: records the engine refused as invalid</li>
 *   <li>{@code processing_latency_ms}: per-record processing time</li>
 * </ul>
 */
public class SentinelMetrics {

    private final Counter datapointsObserved;
    private final Counter anomaliesDetected;
    private final Counter patternsDetected;
    private final Counter recordsRejected;
    private final Histogram processingLatency;

    public SentinelMetrics(MetricGroup metricGroup) {
        MetricGroup sentinelGroup = metricGroup.addGroup("llm_sentinel");

        this.datapointsObserved = sentinelGroup.counter("datapoints_observed_total");
        this.anomaliesDetected = sentinelGroup.counter("anomalies_detected_total");
        this.patternsDetected = sentinelGroup.counter("patterns_detected_total");
        this.recordsRejected = sentinelGroup.counter("records_rejected_total");

        // sliding window of the last 350 samples
        this.processingLatency = sentinelGroup
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void addDatapointsObserved(long count) {
        datapointsObserved.inc(count);
    }

    public void addAnomaliesDetected(long count) {
        anomaliesDetected.inc(count);
    }

    public void incrementPatternsDetected() {
        patternsDetected.inc();
    }

    public void incrementRecordsRejected() {
        recordsRejected.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }
}
