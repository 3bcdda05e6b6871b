package com.llmsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the correlation rule table, loaded from configuration.
 *
 * <p>
 * A rule matches a group of correlated anomalies when at least
 * {@link #getMinMatches()} of its {@link #getMetrics() metric names} are
 * present in the group. Rules are checked in ascending {@code priority};
 * rules with equal priority keep their declaration order.
 * </p>
 *
 * <pre>
 * patterns:
 *   - id: high_token_latency_spike
 *     description: High token count causing increased latency
 *     metrics: [llm.tokens.total, llm.latency.ms]
 *     priority: 10
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Pattern id reported on matching {@link Pattern}s. */
    private String id;

    private String description;

    /** Metric names that make up this pattern. */
    private List<String> metrics = new ArrayList<>();

    /** Required number of present metrics; 0 means all of them. */
    private int minMatches;

    /** Lower values are checked first. */
    private int priority;

    public PatternRule() {
    }

    public PatternRule(String id, String description, List<String> metrics, int priority) {
        this.id = id;
        this.description = description;
        setMetrics(metrics);
        this.priority = priority;
    }

    // ---------------------------------------------------------------
    // Matching
    // ---------------------------------------------------------------

    /**
     * @return the number of metrics that must be present for a match
     */
    public int effectiveMinMatches() {
        return minMatches > 0 ? minMatches : metrics.size();
    }

    /**
     * Return the rule metrics found in {@code presentMetrics}, in rule order.
     *
     * @param presentMetrics metric names of the correlated anomalies
     * @return matching metric names; a match only if the size reaches
     *         {@link #effectiveMinMatches()}
     */
    public List<String> matchedMetrics(Collection<String> presentMetrics) {
        Set<String> present = new HashSet<>(presentMetrics);
        List<String> matched = new ArrayList<>();
        for (String metric : metrics) {
            if (present.contains(metric)) {
                matched.add(metric);
            }
        }
        return matched;
    }

    public boolean matches(Collection<String> presentMetrics) {
        return matchedMetrics(presentMetrics).size() >= effectiveMinMatches();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that the rule is complete and internally consistent.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Pattern 'id' is required");
        } else if (Pattern.UNCLASSIFIED.equals(id)) {
            errors.add("Pattern id '" + Pattern.UNCLASSIFIED + "' is reserved");
        }

        if (metrics.size() < 2) {
            errors.add("Pattern '" + id + "' requires at least 2 'metrics'");
        }
        if (metrics.stream().anyMatch(m -> m == null || m.isBlank())) {
            errors.add("Pattern '" + id + "' contains a blank metric name");
        }
        if (new HashSet<>(metrics).size() != metrics.size()) {
            errors.add("Pattern '" + id + "' lists a metric more than once");
        }
        if (minMatches < 0 || (minMatches > 0 && minMatches < 2)) {
            errors.add("Pattern '" + id + "' requires 'minMatches' >= 2 (or 0 for all), got: " + minMatches);
        } else if (minMatches > metrics.size()) {
            errors.add("Pattern '" + id + "' has 'minMatches' " + minMatches
                    + " greater than its " + metrics.size() + " metric(s)");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid PatternRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public int getMinMatches() {
        return minMatches;
    }

    public void setMinMatches(int minMatches) {
        this.minMatches = minMatches;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PatternRule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "PatternRule{" +
                "id='" + id + '\'' +
                ", metrics=" + metrics +
                ", minMatches=" + minMatches +
                ", priority=" + priority +
                '}';
    }
}
