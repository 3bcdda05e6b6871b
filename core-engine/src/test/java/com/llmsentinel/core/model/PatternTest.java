package com.llmsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Pattern} and {@link PatternRule}.
 */
class PatternTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("Pattern should derive severity and time window from its members")
    void shouldDeriveFromMembers() {
        Pattern pattern = Pattern.builder()
                .patternId("p")
                .memberAnomalies(List.of(
                        anomaly("a", Severity.SEV_3, T0.plusSeconds(4)),
                        anomaly("b", Severity.SEV_1, T0),
                        anomaly("c", Severity.SEV_2, T0.plusSeconds(2))))
                .build();

        assertThat(pattern.getSeverity()).isEqualTo(Severity.SEV_1);
        assertThat(pattern.getWindowStart()).isEqualTo(T0);
        assertThat(pattern.getWindowEnd()).isEqualTo(T0.plusSeconds(4));
        assertThat(pattern.isUnclassified()).isFalse();
    }

    @Test
    @DisplayName("Pattern without members should be rejected")
    void shouldRequireMembers() {
        assertThatThrownBy(() -> Pattern.builder()
                .patternId("p")
                .memberAnomalies(Collections.emptyList())
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Rule should require every metric unless minMatches is set")
    void ruleShouldMatchAllByDefault() {
        PatternRule rule = new PatternRule("r", "d", List.of("a", "b", "c"), 1);

        assertThat(rule.effectiveMinMatches()).isEqualTo(3);
        assertThat(rule.matches(List.of("a", "b"))).isFalse();
        assertThat(rule.matches(List.of("c", "b", "a", "x"))).isTrue();
        assertThat(rule.matchedMetrics(List.of("c", "a"))).containsExactly("a", "c");

        rule.setMinMatches(2);
        assertThat(rule.matches(List.of("a", "b"))).isTrue();
    }

    @Test
    @DisplayName("Rule validation should list every problem")
    void ruleValidationShouldCollectErrors() {
        PatternRule rule = new PatternRule(" ", null, List.of("a", "a"), 1);
        rule.setMinMatches(1);

        assertThatThrownBy(rule::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'id' is required")
                .hasMessageContaining("more than once")
                .hasMessageContaining("minMatches");
    }

    private static Anomaly anomaly(String metric, Severity severity, Instant timestamp) {
        return Anomaly.builder()
                .metricName(metric)
                .value(1)
                .zScore(4)
                .direction(Direction.HIGH)
                .severity(severity)
                .timestamp(timestamp)
                .build();
    }
}
