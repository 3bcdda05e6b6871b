package com.llmsentinel.flink;

import com.llmsentinel.core.model.Anomaly;
import com.llmsentinel.core.model.BatchResult;
import com.llmsentinel.core.model.Pattern;
import com.llmsentinel.core.model.Severity;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Detection result of one {@link MetricRecord}, published to the incident
 * topic for the incident-management collaborator.
 *
 * <p>
 * Only built for records that raised at least one anomaly. {@code pattern}
 * is {@code null} when the anomalies did not correlate; {@code severity} is
 * the pattern severity if there is a pattern, otherwise the most urgent
 * anomaly severity.
 * </p>
 *
 * @since 1.0.0
 */
public class IncidentCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    private String source;
    private String requestId;
    private Instant timestamp;
    private List<Anomaly> anomalies;
    private Pattern pattern;
    private Severity severity;

    /** No-arg constructor required by Jackson. */
    public IncidentCandidate() {
    }

    /**
     * @param record the record that was observed
     * @param result its detection result; must contain at least one anomaly
     * @throws IllegalArgumentException if {@code result} has no anomalies
     */
    public static IncidentCandidate from(MetricRecord record, BatchResult result) {
        Objects.requireNonNull(record, "MetricRecord must not be null");
        Objects.requireNonNull(result, "BatchResult must not be null");
        if (!result.hasAnomalies()) {
            throw new IllegalArgumentException("An incident candidate requires at least one anomaly");
        }

        IncidentCandidate candidate = new IncidentCandidate();
        candidate.source = record.keyOrUnknown();
        candidate.requestId = record.getRequestId();
        candidate.timestamp = result.getAnomalies().get(0).getTimestamp();
        candidate.anomalies = new ArrayList<>(result.getAnomalies());
        candidate.pattern = result.getPattern().orElse(null);
        candidate.severity = result.getPattern()
                .map(Pattern::getSeverity)
                .orElseGet(() -> result.getMaxSeverity().orElseThrow());
        return candidate;
    }

    public String getSource() {
        return source;
    }

    public String getRequestId() {
        return requestId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies != null ? Collections.unmodifiableList(anomalies) : Collections.emptyList();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return "IncidentCandidate{" +
                "source='" + source + '\'' +
                ", requestId='" + requestId + '\'' +
                ", severity=" + severity +
                ", anomalies=" + getAnomalies().size() +
                ", pattern=" + (pattern != null ? pattern.getPatternId() : null) +
                '}';
    }
}
