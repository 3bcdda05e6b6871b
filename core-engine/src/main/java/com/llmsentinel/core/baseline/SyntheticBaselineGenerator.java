package com.llmsentinel.core.baseline;

import com.llmsentinel.core.baseline.BaselineSnapshot.MetricHistory;
import com.llmsentinel.core.config.DetectorConfig;
import com.llmsentinel.core.model.LlmMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Generates synthetic per-metric histories so a registry can detect from the
 * first request instead of waiting for {@code minPoints} real observations.
 *
 * <p>
 * Each well-known metric has a {@link Profile}: values are drawn from a
 * normal distribution, clipped to the profile's range, and a fraction
 * ({@code anomalyRate}) of them is replaced by 3 to 5 sigma outliers so the
 * baseline variance is not unrealistically tight.
 * </p>
 *
 * <p>
 * Generation is deterministic for a given seed.
 * </p>
 */
public class SyntheticBaselineGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticBaselineGenerator.class);

    public static final double DEFAULT_ANOMALY_RATE = 0.05;

    /** Expected distribution of one metric. */
    public static final class Profile {

        private final double mean;
        private final double std;
        private final double min;
        private final double max;

        public Profile(double mean, double std, double min, double max) {
            if (!(std >= 0) || min > max) {
                throw new IllegalArgumentException(
                        "Invalid profile: std=" + std + ", min=" + min + ", max=" + max);
            }
            this.mean = mean;
            this.std = std;
            this.min = min;
            this.max = max;
        }

        public double getMean() {
            return mean;
        }

        public double getStd() {
            return std;
        }

        public double getMin() {
            return min;
        }

        public double getMax() {
            return max;
        }

        double clip(double value) {
            return Math.max(min, Math.min(max, value));
        }
    }

    private static final Map<String, Profile> DEFAULT_PROFILES;

    static {
        Map<String, Profile> p = new LinkedHashMap<>();
        p.put(LlmMetrics.TOKENS_TOTAL, new Profile(500, 150, 50, 2000));
        p.put(LlmMetrics.TOKENS_PROMPT, new Profile(200, 80, 20, 1000));
        p.put(LlmMetrics.TOKENS_RESPONSE, new Profile(300, 100, 20, 1500));
        p.put(LlmMetrics.TOKENS_RATIO, new Profile(0.8, 0.3, 0.1, 3.0));

        p.put(LlmMetrics.COST_PER_REQUEST, new Profile(0.0004, 0.00015, 0.00005, 0.002));
        p.put(LlmMetrics.COST_INPUT, new Profile(0.00005, 0.00002, 0.000005, 0.00025));
        p.put(LlmMetrics.COST_OUTPUT, new Profile(0.00015, 0.00005, 0.00001, 0.00075));

        p.put(LlmMetrics.LATENCY_MS, new Profile(250, 80, 100, 2000));
        p.put(LlmMetrics.THROUGHPUT_TOKENS_PER_SEC, new Profile(2000, 500, 500, 5000));

        p.put(LlmMetrics.PROMPT_LENGTH, new Profile(800, 300, 50, 5000));
        p.put(LlmMetrics.PROMPT_COMPLEXITY_SCORE, new Profile(15, 5, 5, 40));
        p.put(LlmMetrics.PROMPT_QUESTION_COUNT, new Profile(1.5, 1.0, 0, 5));
        p.put(LlmMetrics.PROMPT_CONTEXT_UTILIZATION, new Profile(3, 2, 0.1, 15));

        p.put(LlmMetrics.RESPONSE_LENGTH, new Profile(1200, 500, 50, 8000));
        p.put(LlmMetrics.RESPONSE_IS_REFUSAL, new Profile(0.02, 0.02, 0, 1));
        p.put(LlmMetrics.RESPONSE_HAS_CODE, new Profile(0.15, 0.1, 0, 1));
        p.put(LlmMetrics.RESPONSE_IS_TRUNCATED, new Profile(0.01, 0.01, 0, 1));
        DEFAULT_PROFILES = Collections.unmodifiableMap(p);
    }

    private final Map<String, Profile> profiles;
    private final double anomalyRate;
    private final Random random;

    public SyntheticBaselineGenerator(long seed) {
        this(DEFAULT_PROFILES, DEFAULT_ANOMALY_RATE, seed);
    }

    /**
     * @param profiles    metric name to expected distribution
     * @param anomalyRate fraction of generated values replaced by outliers, in [0, 1)
     * @param seed        random seed
     */
    public SyntheticBaselineGenerator(Map<String, Profile> profiles, double anomalyRate, long seed) {
        Objects.requireNonNull(profiles, "Profiles must not be null");
        if (!(anomalyRate >= 0 && anomalyRate < 1)) {
            throw new IllegalArgumentException("anomalyRate must be in [0, 1), got: " + anomalyRate);
        }
        this.profiles = new LinkedHashMap<>(profiles);
        this.anomalyRate = anomalyRate;
        this.random = new Random(seed);
    }

    /**
     * @return profiles of the well-known LLM metrics
     */
    public static Map<String, Profile> defaultProfiles() {
        return DEFAULT_PROFILES;
    }

    /**
     * Generate {@code pointsPerMetric} values for every profile, using the
     * default window settings.
     */
    public BaselineSnapshot generate(int pointsPerMetric) {
        return generate(pointsPerMetric, new DetectorConfig());
    }

    /**
     * Generate {@code pointsPerMetric} values for every profile.
     *
     * <p>
     * The EWMA of each history is folded over the generated values with the
     * configured alpha, as if they had been observed live.
     * </p>
     *
     * @throws IllegalArgumentException if {@code pointsPerMetric} is not positive
     */
    public BaselineSnapshot generate(int pointsPerMetric, DetectorConfig config) {
        if (pointsPerMetric < 1) {
            throw new IllegalArgumentException("pointsPerMetric must be >= 1, got: " + pointsPerMetric);
        }
        Objects.requireNonNull(config, "DetectorConfig must not be null");

        Map<String, MetricHistory> histories = new LinkedHashMap<>();
        for (Map.Entry<String, Profile> entry : profiles.entrySet()) {
            double[] values = generateValues(entry.getValue(), pointsPerMetric);
            double ewma = values[0];
            for (int i = 1; i < values.length; i++) {
                ewma = config.getEwmaAlpha() * values[i] + (1 - config.getEwmaAlpha()) * ewma;
            }
            histories.put(entry.getKey(), new MetricHistory(values.length, ewma, values));
        }

        LOG.info("Generated synthetic baseline: {} metric(s) x {} point(s), anomalyRate={}",
                histories.size(), pointsPerMetric, anomalyRate);
        return new BaselineSnapshot(Instant.now(), config.getWindowCapacity(), config.getMinPoints(),
                config.getEwmaAlpha(), histories);
    }

    private double[] generateValues(Profile profile, int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = profile.clip(profile.getMean() + random.nextGaussian() * profile.getStd());
        }

        int outliers = (int) (n * anomalyRate);
        for (int i = 0; i < outliers; i++) {
            int idx = random.nextInt(n);
            double sigmas = 3 + random.nextDouble() * 2;
            double sign = random.nextBoolean() ? 1 : -1;
            values[idx] = profile.clip(profile.getMean() + sign * sigmas * profile.getStd());
        }
        return values;
    }
}
