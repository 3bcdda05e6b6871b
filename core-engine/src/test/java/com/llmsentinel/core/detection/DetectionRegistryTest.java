package com.llmsentinel.core.detection;

import com.llmsentinel.core.baseline.BaselineSnapshot;
import com.llmsentinel.core.config.DetectorConfig;
import com.llmsentinel.core.config.DetectorConfigLoader;
import com.llmsentinel.core.model.Anomaly;
import com.llmsentinel.core.model.BatchResult;
import com.llmsentinel.core.model.DetectionSummary;
import com.llmsentinel.core.model.Direction;
import com.llmsentinel.core.model.LlmMetrics;
import com.llmsentinel.core.model.MetricStats;
import com.llmsentinel.core.model.ObservationResult;
import com.llmsentinel.core.model.Pattern;
import com.llmsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DetectionRegistry}.
 */
class DetectionRegistryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private DetectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DetectionRegistry(DetectorConfigLoader.defaults());
    }

    @Nested
    @DisplayName("observeBatch")
    class ObserveBatch {

        @Test
        @DisplayName("Token and latency spike should raise two anomalies and one named pattern")
        void shouldDetectTokenLatencySpike() {
            warmUp(60);

            Map<String, Double> spike = new LinkedHashMap<>();
            spike.put(LlmMetrics.TOKENS_TOTAL, 9000.0);
            spike.put(LlmMetrics.LATENCY_MS, 8000.0);
            BatchResult result = registry.observeBatch(spike, T0.plusSeconds(100));

            assertThat(result.getAnomalies()).hasSize(2);
            assertThat(result.getAnomalies()).extracting(Anomaly::getMetricName)
                    .containsExactly(LlmMetrics.TOKENS_TOTAL, LlmMetrics.LATENCY_MS);
            assertThat(result.getAnomalies()).allSatisfy(a -> {
                assertThat(a.getDirection()).isEqualTo(Direction.HIGH);
                assertThat(a.getTimestamp()).isEqualTo(T0.plusSeconds(100));
            });

            Pattern pattern = result.getPattern().orElseThrow();
            assertThat(pattern.getPatternId()).isEqualTo("high_token_latency_spike");
            assertThat(pattern.getMemberAnomalies()).hasSize(2);

            Severity expected = Severity.max(result.getAnomalies().get(0).getSeverity(),
                    result.getAnomalies().get(1).getSeverity());
            assertThat(pattern.getSeverity()).isEqualTo(expected);
            assertThat(result.getMaxSeverity()).contains(expected);
        }

        @Test
        @DisplayName("Metric order within a batch should not change the pattern")
        void shouldBeOrderIndependent() {
            warmUp(60);

            Map<String, Double> spike = new LinkedHashMap<>();
            spike.put(LlmMetrics.LATENCY_MS, 8000.0);
            spike.put(LlmMetrics.TOKENS_TOTAL, 9000.0);
            BatchResult result = registry.observeBatch(spike, T0.plusSeconds(100));

            assertThat(result.getPattern()).map(Pattern::getPatternId)
                    .contains("high_token_latency_spike");
        }

        @Test
        @DisplayName("A single anomalous metric should raise an anomaly but no pattern")
        void shouldNotCorrelateIsolatedAnomaly() {
            warmUp(60);

            BatchResult result = registry.observeBatch(Map.of(
                    LlmMetrics.TOKENS_TOTAL, 9000.0,
                    LlmMetrics.LATENCY_MS, 300.0), T0.plusSeconds(100));

            assertThat(result.getAnomalies()).hasSize(1);
            assertThat(result.getAnomalies().get(0).getMetricName()).isEqualTo(LlmMetrics.TOKENS_TOTAL);
            assertThat(result.getPattern()).isEmpty();
        }

        @Test
        @DisplayName("Nothing should be reported while history is below minPoints")
        void shouldStayQuietDuringWarmUp() {
            for (int i = 0; i < 9; i++) {
                BatchResult result = registry.observeBatch(
                        Map.of(LlmMetrics.TOKENS_TOTAL, i == 8 ? 1_000_000.0 : 500.0), T0);
                assertThat(result.hasAnomalies()).isFalse();
            }
        }

        @Test
        @DisplayName("An invalid entry should reject the whole batch before any window is touched")
        void shouldValidateWholeBatchFirst() {
            Map<String, Double> batch = new LinkedHashMap<>();
            batch.put(LlmMetrics.TOKENS_TOTAL, 500.0);
            batch.put(LlmMetrics.LATENCY_MS, Double.NaN);

            assertThatThrownBy(() -> registry.observeBatch(batch, T0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining(LlmMetrics.LATENCY_MS);
            assertThat(registry.trackedMetrics()).isEmpty();
            assertThat(registry.summary().getTotalDatapoints()).isZero();
        }

        @Test
        @DisplayName("A missing value should be rejected")
        void shouldRejectNullValue() {
            Map<String, Double> batch = new HashMap<>();
            batch.put(LlmMetrics.TOKENS_TOTAL, null);

            assertThatThrownBy(() -> registry.observeBatch(batch, T0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("no value");
        }
    }

    @Nested
    @DisplayName("observe")
    class Observe {

        @Test
        @DisplayName("Anomalies of different metrics close in time should be correlated")
        void shouldCorrelateWithinWindow() {
            warmUp(60);

            ObservationResult first = registry.observe(LlmMetrics.TOKENS_TOTAL, 9000, T0.plusSeconds(100));
            assertThat(first.getAnomaly()).isPresent();
            assertThat(first.getPattern()).isEmpty();

            ObservationResult second = registry.observe(LlmMetrics.LATENCY_MS, 8000, T0.plusSeconds(102));
            assertThat(second.getAnomaly()).isPresent();
            assertThat(second.getPattern()).map(Pattern::getPatternId)
                    .contains("high_token_latency_spike");
        }

        @Test
        @DisplayName("Repeated anomalies of one metric should not form a pattern")
        void shouldNotCorrelateRepeatsOfOneMetric() {
            warmUp(60);

            for (int i = 0; i < 3; i++) {
                double value = new double[] {9000, 9500, 9900}[i];
                ObservationResult result = registry.observe(LlmMetrics.TOKENS_TOTAL, value,
                        T0.plusSeconds(100 + i));
                assertThat(result.getAnomaly()).isPresent();
                assertThat(result.getPattern()).isEmpty();
            }

            assertThat(registry.summary().getTotalAnomalies()).isEqualTo(3);
            assertThat(registry.summary().getTotalPatterns()).isZero();
        }

        @Test
        @DisplayName("Anomalies further apart than the correlation window should not be correlated")
        void shouldNotCorrelateOutsideWindow() {
            warmUp(60);

            registry.observe(LlmMetrics.TOKENS_TOTAL, 9000, T0.plusSeconds(100));
            ObservationResult late = registry.observe(LlmMetrics.LATENCY_MS, 8000, T0.plusSeconds(200));

            assertThat(late.getAnomaly()).isPresent();
            assertThat(late.getPattern()).isEmpty();
        }

        @Test
        @DisplayName("Should reject invalid input")
        void shouldRejectInvalidInput() {
            assertThatThrownBy(() -> registry.observe("m", Double.POSITIVE_INFINITY, T0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("non-finite");
            assertThatThrownBy(() -> registry.observe("  ", 1, T0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("blank");
            assertThatThrownBy(() -> registry.observe(null, 1, T0))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> registry.observe("m", 1, null))
                    .isInstanceOf(NullPointerException.class);
            assertThat(registry.trackedMetrics()).isEmpty();
        }

        @Test
        @DisplayName("Concurrent observations of one metric should not lose updates")
        void shouldNotLoseConcurrentUpdates() throws Exception {
            int threads = 8;
            int perThread = 1_000;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    int seed = t;
                    futures.add(pool.submit(() -> {
                        Random random = new Random(seed);
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            registry.observe("shared", 100 + random.nextGaussian(), T0);
                            registry.observe("metric-" + seed, 1 + random.nextDouble(), T0);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(registry.metricStats("shared")).map(MetricStats::getCount)
                    .contains((long) threads * perThread);
            assertThat(registry.metricStats("shared").orElseThrow().getSize()).isEqualTo(100);
            assertThat(registry.trackedMetrics()).hasSize(threads + 1);
            assertThat(registry.summary().getTotalDatapoints()).isEqualTo(2L * threads * perThread);
        }
    }

    @Test
    @DisplayName("Recent anomaly buffer should keep only the newest entries")
    void shouldBoundRecentAnomalies() {
        DetectorConfig config = new DetectorConfig();
        config.setMinPoints(2);
        config.setRecentAnomalyLimit(3);
        DetectionRegistry small = new DetectionRegistry(config);

        for (int i = 0; i < 5; i++) {
            String metric = "m" + i;
            for (int j = 0; j < 20; j++) {
                small.observe(metric, 10, T0);
            }
            small.observe(metric, 1000, T0.plusSeconds(i * 60L));
        }

        assertThat(small.summary().getTotalAnomalies()).isEqualTo(5);
        assertThat(small.summary().getRecentAnomalies()).isEqualTo(3);
        assertThat(small.recentAnomalies(10)).extracting(Anomaly::getMetricName)
                .containsExactly("m2", "m3", "m4");
        assertThat(small.recentAnomalies(1)).extracting(Anomaly::getMetricName)
                .containsExactly("m4");
    }

    @Test
    @DisplayName("Summary should report counters and per-metric statistics")
    void shouldSummarize() {
        warmUp(20);
        registry.observeBatch(Map.of(LlmMetrics.TOKENS_TOTAL, 9000.0, LlmMetrics.LATENCY_MS, 8000.0),
                T0.plusSeconds(100));

        DetectionSummary summary = registry.summary();

        assertThat(summary.getTotalDatapoints()).isEqualTo(42);
        assertThat(summary.getTotalAnomalies()).isEqualTo(2);
        assertThat(summary.getTotalPatterns()).isEqualTo(1);
        assertThat(summary.getMetricsTracked()).isEqualTo(2);
        assertThat(summary.getPerMetricStats()).containsOnlyKeys(LlmMetrics.LATENCY_MS, LlmMetrics.TOKENS_TOTAL);
        assertThat(summary.getPerMetricStats().get(LlmMetrics.TOKENS_TOTAL).getCount()).isEqualTo(21);
        assertThat(summary.getPerMetricStats().get(LlmMetrics.TOKENS_TOTAL).isValid()).isTrue();
    }

    @Test
    @DisplayName("Reset should drop all state")
    void shouldReset() {
        warmUp(20);
        registry.observe(LlmMetrics.TOKENS_TOTAL, 9000, T0);

        registry.reset();

        assertThat(registry.trackedMetrics()).isEmpty();
        assertThat(registry.recentAnomalies(10)).isEmpty();
        assertThat(registry.summary().getTotalDatapoints()).isZero();
        assertThat(registry.summary().getTotalAnomalies()).isZero();
    }

    @Test
    @DisplayName("A restored registry should judge values like the original")
    void shouldRestoreFromSnapshot() {
        warmUp(60);
        BaselineSnapshot snapshot = registry.snapshot();

        DetectionRegistry restored = new DetectionRegistry(DetectorConfigLoader.defaults());
        restored.restore(snapshot);

        MetricStats before = registry.metricStats(LlmMetrics.TOKENS_TOTAL).orElseThrow();
        MetricStats after = restored.metricStats(LlmMetrics.TOKENS_TOTAL).orElseThrow();
        assertThat(after.getCount()).isEqualTo(before.getCount());
        assertThat(after.getMean()).isCloseTo(before.getMean(), within(1e-9));
        assertThat(after.getStd()).isCloseTo(before.getStd(), within(1e-9));
        assertThat(after.getEwmaBaseline()).isEqualTo(before.getEwmaBaseline());

        BatchResult result = restored.observeBatch(Map.of(
                LlmMetrics.TOKENS_TOTAL, 9000.0, LlmMetrics.LATENCY_MS, 8000.0), T0);
        assertThat(result.getPattern()).map(Pattern::getPatternId).contains("high_token_latency_spike");
    }

    @Test
    @DisplayName("Restoring while observing should keep every window consistent")
    void shouldRestoreWhileObserving() throws Exception {
        double[] history = new double[100];
        for (int i = 0; i < history.length; i++) {
            history[i] = 100 + (i % 5);
        }
        BaselineSnapshot snapshot = new BaselineSnapshot(T0, 100, 10, 0.1, Map.of(
                "shared", new BaselineSnapshot.MetricHistory(500, 102.0, history)));

        int threads = 4;
        int perThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.observe("shared", 100 + (i % 5), T0);
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    registry.restore(snapshot);
                }
                return null;
            }));
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        MetricStats stats = registry.metricStats("shared").orElseThrow();
        assertThat(stats.getSize()).isEqualTo(100);
        assertThat(stats.getCount()).isGreaterThanOrEqualTo(500);
        assertThat(stats.getMean()).isBetween(100.0, 104.0);
        assertThat(registry.summary().getTotalDatapoints()).isEqualTo((long) threads * perThread);

        registry.restore(snapshot);
        MetricStats restored = registry.metricStats("shared").orElseThrow();
        assertThat(restored.getCount()).isEqualTo(500);
        assertThat(restored.getMean()).isCloseTo(102.0, within(1e-9));
        assertThat(restored.getEwmaBaseline()).isEqualTo(102.0);
    }

    @Test
    @DisplayName("Restore should reject non-finite values")
    void shouldRejectCorruptSnapshot() {
        BaselineSnapshot snapshot = new BaselineSnapshot(T0, 100, 10, 0.1, Map.of(
                "m", new BaselineSnapshot.MetricHistory(3, 1.0, new double[] {1, Double.NaN, 1})));

        assertThatThrownBy(() -> registry.restore(snapshot))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.trackedMetrics()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Tokens within 500 ± 50 and latency within 300 ± 40, one request per second. */
    private void warmUp(int requests) {
        double[] offsets = {-1.0, 0.5, -0.25, 1.0, 0.0, -0.5, 0.25};
        for (int i = 0; i < requests; i++) {
            double offset = offsets[i % offsets.length];
            Map<String, Double> metrics = new LinkedHashMap<>();
            metrics.put(LlmMetrics.TOKENS_TOTAL, 500 + offset * 50);
            metrics.put(LlmMetrics.LATENCY_MS, 300 - offset * 40);
            BatchResult result = registry.observeBatch(metrics, T0.plusSeconds(i));
            assertThat(result.hasAnomalies()).isFalse();
        }
    }
}
