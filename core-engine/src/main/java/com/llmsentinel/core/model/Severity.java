package com.llmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Ordinal urgency of an anomaly or pattern. {@link #SEV_1} is the most urgent.
 *
 * @since 1.0.0
 */
public enum Severity {

    SEV_1("SEV-1", 1),
    SEV_2("SEV-2", 2),
    SEV_3("SEV-3", 3);

    private final String label;
    private final int rank;

    Severity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    /**
     * @return the external label, e.g. {@code SEV-1}
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @return numeric rank; lower is more urgent
     */
    public int getRank() {
        return rank;
    }

    public boolean isMoreSevereThan(Severity other) {
        Objects.requireNonNull(other, "Severity must not be null");
        return rank < other.rank;
    }

    /**
     * Return the more urgent of two severities.
     */
    public static Severity max(Severity a, Severity b) {
        return b.isMoreSevereThan(a) ? b : a;
    }

    /**
     * Parse an external label ({@code SEV-2}) or enum name ({@code SEV_2}).
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static Severity fromLabel(String label) {
        Objects.requireNonNull(label, "Severity label must not be null");
        String normalised = label.trim().toUpperCase(Locale.ROOT).replace('_', '-');
        for (Severity s : values()) {
            if (s.label.equals(normalised)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + label
                + "'. Supported: SEV-1, SEV-2, SEV-3");
    }

    @Override
    public String toString() {
        return label;
    }
}
