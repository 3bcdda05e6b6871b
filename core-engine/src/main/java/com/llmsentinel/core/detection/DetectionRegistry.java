package com.llmsentinel.core.detection;

import com.llmsentinel.core.baseline.BaselineSnapshot;
import com.llmsentinel.core.baseline.BaselineSnapshot.MetricHistory;
import com.llmsentinel.core.config.DetectorConfig;
import com.llmsentinel.core.model.Anomaly;
import com.llmsentinel.core.model.BatchResult;
import com.llmsentinel.core.model.DetectionSummary;
import com.llmsentinel.core.model.MetricStats;
import com.llmsentinel.core.model.ObservationResult;
import com.llmsentinel.core.model.Pattern;
import com.llmsentinel.core.stats.MetricWindow;
import com.llmsentinel.core.stats.WindowSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the detection engine: owns one {@link MetricWindow} per
 * metric name and turns observations into anomalies and patterns.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   observe(metric, value, ts)
 *     → MetricWindow.update(value)          (always, anomalous or not)
 *     → AnomalyEvaluator.evaluate(snapshot)
 *     → recent-anomaly buffer
 *     → PatternCorrelator                   (per batch, or by timestamp)
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Windows are created lazily in a {@link ConcurrentHashMap}. Each
 * update-then-evaluate sequence holds that window's monitor, so observations
 * of one metric are serialized while different metrics proceed in parallel.
 * The bounded recent-anomaly buffer is guarded by its own monitor.
 * </p>
 * <p>
 * {@link #restore(BaselineSnapshot)} and {@link #reset()} swap windows out
 * of the map; an observation that finds its window retired retries on the
 * current one, so no value is written into a discarded window. Observations
 * racing with {@link #reset()} may or may not be reflected in the counters
 * it clears.
 * </p>
 *
 * <h3>Input</h3>
 * <p>
 * Metric names must be non-blank and values finite; anything else is a caller
 * defect and fails with {@link IllegalArgumentException} before any state is
 * touched.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRegistry implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(DetectionRegistry.class);

    private final int windowCapacity;
    private final int minPoints;
    private final double ewmaAlpha;
    private final int recentAnomalyLimit;
    private final Duration correlationWindow;

    private final AnomalyEvaluator evaluator;
    private final PatternCorrelator correlator;

    private final ConcurrentHashMap<String, MetricWindow> windows = new ConcurrentHashMap<>();

    /** Most recent anomalies, oldest first; also the monitor for itself. */
    private final ArrayDeque<Anomaly> recentAnomalies = new ArrayDeque<>();

    private final AtomicLong totalDatapoints = new AtomicLong();
    private final AtomicLong totalAnomalies = new AtomicLong();
    private final AtomicLong totalPatterns = new AtomicLong();

    /**
     * @param config detector configuration; validated here
     * @throws NullPointerException  if {@code config} is {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public DetectionRegistry(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();

        this.windowCapacity = config.getWindowCapacity();
        this.minPoints = config.getMinPoints();
        this.ewmaAlpha = config.getEwmaAlpha();
        this.recentAnomalyLimit = config.getRecentAnomalyLimit();
        this.correlationWindow = Duration.ofSeconds(config.getCorrelationWindowSeconds());
        this.evaluator = new AnomalyEvaluator(config.getThreshold(), config.getSeverity());
        this.correlator = new PatternCorrelator(config.getPatterns());

        LOG.info("DetectionRegistry created: capacity={} minPoints={} threshold={} alpha={} patterns={}",
                windowCapacity, minPoints, config.getThreshold(), ewmaAlpha, config.getPatterns().size());
    }

    // ---------------------------------------------------------------
    // Observation
    // ---------------------------------------------------------------

    /**
     * Observe one metric value.
     *
     * <p>
     * When the value is anomalous, it is correlated with the recent anomalies
     * whose timestamps fall within the configured correlation window.
     * </p>
     *
     * @param metricName non-blank metric name
     * @param value      finite value
     * @param timestamp  logical time of the observation
     * @return the anomaly and pattern raised, if any
     * @throws IllegalArgumentException if the name is blank or the value is
     *                                  not finite
     * @throws NullPointerException     if the name or timestamp is {@code null}
     */
    public ObservationResult observe(String metricName, double value, Instant timestamp) {
        validateInput(metricName, value);
        Objects.requireNonNull(timestamp, "Timestamp must not be null");

        Optional<Anomaly> anomaly = record(metricName, value, timestamp);
        if (anomaly.isEmpty()) {
            return ObservationResult.none();
        }

        List<Anomaly> lookback;
        synchronized (recentAnomalies) {
            lookback = new ArrayList<>(recentAnomalies);
        }
        Optional<Pattern> pattern = correlator.correlate(anomaly.get(), lookback, correlationWindow);
        pattern.ifPresent(this::recordPattern);

        return ObservationResult.of(anomaly.get(), pattern.orElse(null));
    }

    /**
     * Observe every metric of one logical request.
     *
     * <p>
     * All anomalies carry the batch timestamp. Correlation runs once, after
     * every metric has been observed, over exactly the anomalies of this
     * batch; the order of the metrics does not change the resulting pattern.
     * The whole batch is validated before any window is updated.
     * </p>
     *
     * @param metrics   metric name to value
     * @param timestamp logical time of the request
     * @return anomalies raised, in the map's iteration order, and the pattern
     * @throws IllegalArgumentException if any name is blank or any value is
     *                                  missing or not finite
     */
    public BatchResult observeBatch(Map<String, Double> metrics, Instant timestamp) {
        Objects.requireNonNull(metrics, "Metrics must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");

        for (Map.Entry<String, Double> entry : metrics.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Metric '" + entry.getKey() + "' has no value");
            }
            validateInput(entry.getKey(), entry.getValue());
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, Double> entry : metrics.entrySet()) {
            record(entry.getKey(), entry.getValue(), timestamp).ifPresent(anomalies::add);
        }

        Optional<Pattern> pattern = correlator.correlate(anomalies);
        pattern.ifPresent(this::recordPattern);

        return BatchResult.of(anomalies, pattern.orElse(null));
    }

    // ---------------------------------------------------------------
    // Read-only accessors
    // ---------------------------------------------------------------

    /**
     * @return statistics for {@code metricName}, or empty if never observed
     */
    public Optional<MetricStats> metricStats(String metricName) {
        MetricWindow window = windows.get(metricName);
        if (window == null) {
            return Optional.empty();
        }
        return Optional.of(statsOf(metricName, window));
    }

    /**
     * @return names of all observed metrics, sorted
     */
    public Set<String> trackedMetrics() {
        return Collections.unmodifiableSet(new TreeSet<>(windows.keySet()));
    }

    /**
     * @param limit maximum number of anomalies to return
     * @return up to {@code limit} most recent anomalies, oldest first
     */
    public List<Anomaly> recentAnomalies(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        List<Anomaly> all;
        synchronized (recentAnomalies) {
            all = new ArrayList<>(recentAnomalies);
        }
        return Collections.unmodifiableList(
                new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size())));
    }

    /**
     * @return counters and per-metric statistics for health reporting
     */
    public DetectionSummary summary() {
        Map<String, MetricStats> perMetric = new HashMap<>();
        windows.forEach((name, window) -> perMetric.put(name, statsOf(name, window)));

        int recent;
        synchronized (recentAnomalies) {
            recent = recentAnomalies.size();
        }
        return new DetectionSummary(totalDatapoints.get(), totalAnomalies.get(), totalPatterns.get(),
                recent, perMetric);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Capture the retained history of every metric.
     */
    public BaselineSnapshot snapshot() {
        Map<String, MetricHistory> histories = new LinkedHashMap<>();
        for (String name : new TreeSet<>(windows.keySet())) {
            MetricWindow window = windows.get(name);
            if (window == null) {
                continue;
            }
            synchronized (window) {
                histories.put(name, new MetricHistory(window.getCount(), window.getEwmaBaseline(),
                        window.values()));
            }
        }
        return new BaselineSnapshot(Instant.now(), windowCapacity, minPoints, ewmaAlpha, histories);
    }

    /**
     * Replace the windows of every metric in {@code snapshot} with the captured
     * history. Metrics absent from the snapshot are left untouched; counters are
     * not changed. Observations running concurrently land either in the
     * replaced window (before the restore) or in the restored one.
     *
     * @throws IllegalArgumentException if a metric name is blank or a captured
     *                                  value is not finite
     */
    public void restore(BaselineSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "BaselineSnapshot must not be null");

        for (Map.Entry<String, MetricHistory> entry : snapshot.getMetrics().entrySet()) {
            for (double v : entry.getValue().getValues()) {
                validateInput(entry.getKey(), v);
            }
        }
        if (snapshot.getWindowCapacity() > 0 && snapshot.getWindowCapacity() != windowCapacity) {
            LOG.warn("Snapshot was captured with window capacity {}, registry uses {}",
                    snapshot.getWindowCapacity(), windowCapacity);
        }

        snapshot.getMetrics().forEach((name, history) -> windows.put(name,
                MetricWindow.fromHistory(windowCapacity, minPoints, ewmaAlpha,
                        history.getValues(), history.getCount(), history.getEwmaBaseline())));

        LOG.info("Restored baseline for {} metric(s) captured at {}",
                snapshot.getMetrics().size(), snapshot.getCreatedAt());
    }

    /**
     * Drop all windows, recent anomalies and counters.
     */
    public void reset() {
        for (Map.Entry<String, MetricWindow> entry : windows.entrySet()) {
            synchronized (entry.getValue()) {
                windows.remove(entry.getKey(), entry.getValue());
            }
        }
        synchronized (recentAnomalies) {
            recentAnomalies.clear();
        }
        totalDatapoints.set(0);
        totalAnomalies.set(0);
        totalPatterns.set(0);
        LOG.info("DetectionRegistry reset");
    }

    public AnomalyEvaluator getEvaluator() {
        return evaluator;
    }

    public PatternCorrelator getCorrelator() {
        return correlator;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<Anomaly> record(String metricName, double value, Instant timestamp) {
        Optional<Anomaly> anomaly = Optional.empty();
        boolean recorded = false;
        while (!recorded) {
            MetricWindow window = windows.computeIfAbsent(metricName, this::newWindow);
            synchronized (window) {
                // restore() or reset() may have retired this window; retry on its successor
                if (windows.get(metricName) == window) {
                    WindowSnapshot snapshot = window.update(value);
                    anomaly = evaluator.evaluate(snapshot, value, metricName, timestamp);
                    totalDatapoints.incrementAndGet();
                    recorded = true;
                }
            }
        }

        anomaly.ifPresent(this::recordAnomaly);
        return anomaly;
    }

    private MetricWindow newWindow(String metricName) {
        LOG.debug("Tracking new metric [{}]", metricName);
        return new MetricWindow(windowCapacity, minPoints, ewmaAlpha);
    }

    private void recordAnomaly(Anomaly anomaly) {
        totalAnomalies.incrementAndGet();
        synchronized (recentAnomalies) {
            recentAnomalies.addLast(anomaly);
            while (recentAnomalies.size() > recentAnomalyLimit) {
                recentAnomalies.pollFirst();
            }
        }
        LOG.warn("Anomaly detected: {}={} (z={}, {}%, severity={})",
                anomaly.getMetricName(), anomaly.getValue(),
                String.format("%.2f", anomaly.getZScore()),
                String.format("%+.1f", anomaly.getDeviationPercent()),
                anomaly.getSeverity());
    }

    private void recordPattern(Pattern pattern) {
        totalPatterns.incrementAndGet();
        LOG.warn("Pattern detected: {} (severity={}, members={})",
                pattern.getPatternId(), pattern.getSeverity(), pattern.getMemberAnomalies().size());
    }

    private static MetricStats statsOf(String name, MetricWindow window) {
        synchronized (window) {
            return new MetricStats(name, window.getCount(), window.size(), window.getMean(),
                    window.getStd(), window.getEwmaBaseline(), window.isValid());
        }
    }

    private static void validateInput(String metricName, double value) {
        Objects.requireNonNull(metricName, "Metric name must not be null");
        if (metricName.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "Metric '" + metricName + "' has a non-finite value: " + value);
        }
    }
}
