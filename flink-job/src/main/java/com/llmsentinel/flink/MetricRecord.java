package com.llmsentinel.flink;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-request metrics as published by the extraction service.
 *
 * <pre>
 * {
 *   "source": "gemini-pro",
 *   "requestId": "req-42",
 *   "timestamp": "2024-05-01T12:00:00Z",
 *   "metrics": { "llm.tokens.total": 512, "llm.latency.ms": 240.5 }
 * }
 * </pre>
 *
 * <p>
 * {@code source} identifies the model or deployment the request went to and
 * is the key detection state is partitioned by.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    static final String UNKNOWN_SOURCE = "__unknown__";

    private String source;
    private String requestId;
    private Instant timestamp;
    private Map<String, Double> metrics = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public MetricRecord() {
    }

    public MetricRecord(String source, String requestId, Instant timestamp, Map<String, Double> metrics) {
        this.source = source;
        this.requestId = requestId;
        this.timestamp = timestamp;
        setMetrics(metrics);
    }

    /**
     * @return the source, or {@value #UNKNOWN_SOURCE} when it is missing
     */
    public String keyOrUnknown() {
        return source != null && !source.isBlank() ? source : UNKNOWN_SOURCE;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * @return unmodifiable map of metric name to value, in arrival order
     */
    public Map<String, Double> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public void setMetrics(Map<String, Double> metrics) {
        this.metrics = metrics != null ? new LinkedHashMap<>(metrics) : new LinkedHashMap<>();
    }

    @Override
    public String toString() {
        return "MetricRecord{" +
                "source='" + source + '\'' +
                ", requestId='" + requestId + '\'' +
                ", timestamp=" + timestamp +
                ", metrics=" + metrics.size() +
                '}';
    }
}
