package com.llmsentinel.core.detection;

import com.llmsentinel.core.model.Anomaly;
import com.llmsentinel.core.model.Pattern;
import com.llmsentinel.core.model.PatternRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Groups co-occurring anomalies into a named {@link Pattern}.
 *
 * <h3>Rule table</h3>
 * <p>
 * Rules are checked in ascending priority (declaration order breaks ties).
 * The first rule with at least {@code minMatches} of its metrics present in
 * the group wins. A group spanning two or more metrics that matches no rule is
 * reported as {@value Pattern#UNCLASSIFIED}. Anomalies of a single metric,
 * however many, never form a pattern.
 * </p>
 *
 * <p>
 * Pure function of its inputs; thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternCorrelator implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PatternCorrelator.class);

    static final String UNCLASSIFIED_DESCRIPTION = "Multiple correlated anomalies matching no known pattern";

    /** Rules sorted by priority. */
    private final ArrayList<PatternRule> rules;

    /**
     * @param rules rule table; each rule is validated
     * @throws NullPointerException  if {@code rules} is {@code null}
     * @throws IllegalStateException if a rule is invalid
     */
    public PatternCorrelator(List<PatternRule> rules) {
        Objects.requireNonNull(rules, "Pattern rules must not be null");
        rules.forEach(PatternRule::validate);
        this.rules = new ArrayList<>(rules);
        // List.sort is stable, so equal priorities keep declaration order
        this.rules.sort(Comparator.comparingInt(PatternRule::getPriority));
    }

    /**
     * Correlate a new anomaly with recent ones by timestamp.
     *
     * <p>
     * The group is every anomaly in {@code recentAnomalies} whose timestamp
     * lies within {@code correlationWindow} of {@code newAnomaly}'s (inclusive),
     * followed by {@code newAnomaly} itself. {@code newAnomaly} is not counted
     * twice if the recent collection already holds it.
     * </p>
     *
     * @return the pattern, or empty if the group spans fewer than two metrics
     */
    public Optional<Pattern> correlate(Anomaly newAnomaly, Collection<Anomaly> recentAnomalies,
            Duration correlationWindow) {
        Objects.requireNonNull(newAnomaly, "New anomaly must not be null");
        Objects.requireNonNull(recentAnomalies, "Recent anomalies must not be null");
        Objects.requireNonNull(correlationWindow, "Correlation window must not be null");

        long windowMillis = correlationWindow.toMillis();
        long anchor = newAnomaly.getTimestamp().toEpochMilli();

        List<Anomaly> group = new ArrayList<>();
        for (Anomaly candidate : recentAnomalies) {
            if (candidate == newAnomaly) {
                continue;
            }
            if (Math.abs(candidate.getTimestamp().toEpochMilli() - anchor) <= windowMillis) {
                group.add(candidate);
            }
        }
        group.add(newAnomaly);

        return correlate(group);
    }

    /**
     * Classify the anomalies of one logical request.
     *
     * @param anomalies anomalies produced together, in observation order
     * @return the pattern, or empty if fewer than two distinct metrics are
     *         anomalous
     */
    public Optional<Pattern> correlate(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "Anomalies must not be null");

        Set<String> present = new LinkedHashSet<>();
        for (Anomaly a : anomalies) {
            present.add(a.getMetricName());
        }
        if (present.size() < 2) {
            // repeats of one metric are not a cross-metric pattern
            return Optional.empty();
        }

        for (PatternRule rule : rules) {
            List<String> matched = rule.matchedMetrics(present);
            if (matched.size() >= rule.effectiveMinMatches()) {
                Pattern pattern = Pattern.builder()
                        .patternId(rule.getId())
                        .description(rule.getDescription())
                        .matchedMetrics(matched)
                        .memberAnomalies(anomalies)
                        .build();
                LOG.debug("Pattern [{}] matched metrics {}", rule.getId(), matched);
                return Optional.of(pattern);
            }
        }

        LOG.debug("No pattern rule matched metrics {}; reporting as {}", present, Pattern.UNCLASSIFIED);
        return Optional.of(Pattern.builder()
                .patternId(Pattern.UNCLASSIFIED)
                .description(UNCLASSIFIED_DESCRIPTION)
                .memberAnomalies(anomalies)
                .build());
    }

    /**
     * @return unmodifiable rule table in evaluation order
     */
    public List<PatternRule> getRules() {
        return Collections.unmodifiableList(rules);
    }
}
