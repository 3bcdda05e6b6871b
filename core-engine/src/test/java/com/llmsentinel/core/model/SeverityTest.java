package com.llmsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Severity} and {@link Direction}.
 */
class SeverityTest {

    @Test
    @DisplayName("SEV-1 should be the most urgent")
    void shouldOrderByUrgency() {
        assertThat(Severity.SEV_1.isMoreSevereThan(Severity.SEV_2)).isTrue();
        assertThat(Severity.SEV_3.isMoreSevereThan(Severity.SEV_2)).isFalse();
        assertThat(Severity.max(Severity.SEV_3, Severity.SEV_1)).isEqualTo(Severity.SEV_1);
        assertThat(Severity.max(Severity.SEV_2, Severity.SEV_2)).isEqualTo(Severity.SEV_2);
    }

    @Test
    @DisplayName("Should parse labels and enum names")
    void shouldParseLabels() {
        assertThat(Severity.fromLabel("SEV-2")).isEqualTo(Severity.SEV_2);
        assertThat(Severity.fromLabel(" sev_1 ")).isEqualTo(Severity.SEV_1);
        assertThat(Severity.SEV_3).hasToString("SEV-3");
        assertThatThrownBy(() -> Severity.fromLabel("SEV-9"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown severity");
    }

    @Test
    @DisplayName("Direction should follow the sign of z")
    void directionShouldFollowSign() {
        assertThat(Direction.of(3.5)).isEqualTo(Direction.HIGH);
        assertThat(Direction.of(-3.5)).isEqualTo(Direction.LOW);
        assertThat(Direction.HIGH.getLabel()).isEqualTo("high");
    }
}
