package com.llmsentinel.core.config;

import com.llmsentinel.core.model.PatternRule;
import com.llmsentinel.core.stats.MetricWindow;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the detector YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * windowCapacity: 100
 * minPoints: 10
 * threshold: 3.0
 * ewmaAlpha: 0.1
 * recentAnomalyLimit: 50
 * correlationWindowSeconds: 5
 * severity:
 *   sev1: 6.0
 *   sev2: 4.5
 * patterns:
 *   - id: high_token_latency_spike
 *     metrics: [llm.tokens.total, llm.latency.ms]
 * </pre>
 *
 * <p>
 * The configuration is read once when a registry is built; call
 * {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_RECENT_ANOMALY_LIMIT = 50;
    public static final long DEFAULT_CORRELATION_WINDOW_SECONDS = 5;

    private int windowCapacity = MetricWindow.DEFAULT_CAPACITY;
    private int minPoints = MetricWindow.DEFAULT_MIN_POINTS;
    private double threshold = DEFAULT_THRESHOLD;
    private double ewmaAlpha = MetricWindow.DEFAULT_EWMA_ALPHA;
    private int recentAnomalyLimit = DEFAULT_RECENT_ANOMALY_LIMIT;
    private long correlationWindowSeconds = DEFAULT_CORRELATION_WINDOW_SECONDS;
    private SeverityThresholds severity = new SeverityThresholds();
    private List<PatternRule> patterns = new ArrayList<>();

    /**
     * Validate every setting and every pattern rule.
     *
     * <p>
     * Collects all errors and throws a single exception if any is invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowCapacity < 2) {
            errors.add("'windowCapacity' must be >= 2, got: " + windowCapacity);
        }
        if (minPoints < 2) {
            errors.add("'minPoints' must be >= 2, got: " + minPoints);
        } else if (minPoints > windowCapacity) {
            errors.add("'minPoints' (" + minPoints + ") must not exceed 'windowCapacity' ("
                    + windowCapacity + ")");
        }
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            errors.add("'threshold' must be a finite value > 0, got: " + threshold);
        }
        if (!(ewmaAlpha > 0 && ewmaAlpha <= 1)) {
            errors.add("'ewmaAlpha' must be in (0, 1], got: " + ewmaAlpha);
        }
        if (recentAnomalyLimit < 1) {
            errors.add("'recentAnomalyLimit' must be >= 1, got: " + recentAnomalyLimit);
        }
        if (correlationWindowSeconds < 0) {
            errors.add("'correlationWindowSeconds' must be >= 0, got: " + correlationWindowSeconds);
        }

        if (severity == null) {
            errors.add("'severity' must not be null");
        } else {
            try {
                severity.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < patterns.size(); i++) {
            PatternRule rule = patterns.get(i);
            if (rule == null) {
                errors.add("Pattern at index " + i + " is null");
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getId() != null && !ids.add(rule.getId())) {
                errors.add("Duplicate pattern id: '" + rule.getId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detector configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

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

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    public int getRecentAnomalyLimit() {
        return recentAnomalyLimit;
    }

    public void setRecentAnomalyLimit(int recentAnomalyLimit) {
        this.recentAnomalyLimit = recentAnomalyLimit;
    }

    public long getCorrelationWindowSeconds() {
        return correlationWindowSeconds;
    }

    public void setCorrelationWindowSeconds(long correlationWindowSeconds) {
        this.correlationWindowSeconds = correlationWindowSeconds;
    }

    public SeverityThresholds getSeverity() {
        return severity;
    }

    public void setSeverity(SeverityThresholds severity) {
        this.severity = severity;
    }

    /**
     * @return unmodifiable list of pattern rules, in declaration order
     */
    public List<PatternRule> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    /**
     * Set the pattern rules (used by SnakeYAML during deserialization).
     */
    public void setPatterns(List<PatternRule> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "windowCapacity=" + windowCapacity +
                ", minPoints=" + minPoints +
                ", threshold=" + threshold +
                ", ewmaAlpha=" + ewmaAlpha +
                ", recentAnomalyLimit=" + recentAnomalyLimit +
                ", correlationWindowSeconds=" + correlationWindowSeconds +
                ", severity=" + severity +
                ", patterns=" + patterns.size() +
                '}';
    }
}
