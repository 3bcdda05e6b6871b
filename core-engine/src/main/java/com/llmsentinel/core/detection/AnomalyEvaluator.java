package com.llmsentinel.core.detection;

import com.llmsentinel.core.config.SeverityThresholds;
import com.llmsentinel.core.model.Anomaly;
import com.llmsentinel.core.model.Direction;
import com.llmsentinel.core.model.Severity;
import com.llmsentinel.core.stats.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Z-score evaluation of a single value against its window statistics.
 *
 * <p>
 * A value is anomalous when {@code |z| > threshold}, with
 * {@code z = (value - mean) / std}. The snapshot passed in is taken
 * <em>after</em> the value was added to its window, so outliers become part
 * of the history they are judged against.
 * </p>
 *
 * <h3>No verdict</h3>
 * <ul>
 * <li>window not yet valid (fewer than {@code minPoints} observations)</li>
 * <li>zero variance: every retained value is identical, z is undefined</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyEvaluator implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyEvaluator.class);

    /**
     * Relative tolerance under which a standard deviation counts as zero.
     * Recomputing the mean of identical values can leave a residue of a few ulps.
     */
    static final double ZERO_STD_TOLERANCE = 1e-9;

    private final double threshold;
    private final double sev1Threshold;
    private final double sev2Threshold;

    /**
     * @param threshold |z| above which a value is anomalous; must be &gt; 0
     * @param severity  severity boundaries; must not be {@code null}
     * @throws IllegalArgumentException if the threshold is not positive
     * @throws IllegalStateException    if the severity boundaries are invalid
     */
    public AnomalyEvaluator(double threshold, SeverityThresholds severity) {
        Objects.requireNonNull(severity, "SeverityThresholds must not be null");
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("threshold must be a finite value > 0, got: " + threshold);
        }
        severity.validate();
        this.threshold = threshold;
        this.sev1Threshold = severity.getSev1();
        this.sev2Threshold = severity.getSev2();
    }

    /**
     * Evaluate with the configured threshold.
     *
     * @see #evaluate(WindowSnapshot, double, String, Instant, double)
     */
    public Optional<Anomaly> evaluate(WindowSnapshot snapshot, double value,
            String metricName, Instant timestamp) {
        return evaluate(snapshot, value, metricName, timestamp, threshold);
    }

    /**
     * Decide whether {@code value} is anomalous for its window.
     *
     * @param snapshot   window statistics after {@code value} was recorded
     * @param value      the observed value
     * @param metricName metric the value belongs to
     * @param timestamp  logical time of the observation
     * @param threshold  |z| above which the value is anomalous
     * @return the anomaly, or empty when there is no verdict or the value is
     *         within the threshold
     */
    public Optional<Anomaly> evaluate(WindowSnapshot snapshot, double value,
            String metricName, Instant timestamp, double threshold) {
        Objects.requireNonNull(snapshot, "WindowSnapshot must not be null");

        if (!snapshot.isValid()) {
            LOG.trace("Metric [{}]: {} observation(s), not enough history", metricName, snapshot.getCount());
            return Optional.empty();
        }

        double mean = snapshot.getMean();
        double std = snapshot.getStd();
        if (isDegenerate(mean, std)) {
            LOG.trace("Metric [{}]: zero variance, no z-score", metricName);
            return Optional.empty();
        }

        double z = (value - mean) / std;
        if (Math.abs(z) <= threshold) {
            return Optional.empty();
        }

        double deviationPercent = mean != 0 ? (value - mean) / mean * 100 : 0;

        return Optional.of(Anomaly.builder()
                .metricName(metricName)
                .value(value)
                .zScore(z)
                .deviationPercent(deviationPercent)
                .direction(Direction.of(z))
                .severity(severityFor(Math.abs(z)))
                .baselineMean(mean)
                .baselineStd(std)
                .ewmaBaseline(snapshot.getEwmaBaseline())
                .timestamp(timestamp)
                .build());
    }

    /**
     * Map an absolute z-score to a severity. Monotonic: a larger |z| never
     * yields a less urgent severity.
     */
    public Severity severityFor(double absZ) {
        if (absZ >= sev1Threshold) {
            return Severity.SEV_1;
        }
        if (absZ >= sev2Threshold) {
            return Severity.SEV_2;
        }
        return Severity.SEV_3;
    }

    public double getThreshold() {
        return threshold;
    }

    static boolean isDegenerate(double mean, double std) {
        return std <= ZERO_STD_TOLERANCE * Math.max(1.0, Math.abs(mean));
    }
}
