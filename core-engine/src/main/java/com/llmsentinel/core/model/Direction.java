package com.llmsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Side of the baseline on which an anomalous value lies.
 */
public enum Direction {

    HIGH("high"),
    LOW("low");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @param zScore signed z-score
     * @return {@link #HIGH} for a positive score, {@link #LOW} otherwise
     */
    public static Direction of(double zScore) {
        return zScore > 0 ? HIGH : LOW;
    }

    @Override
    public String toString() {
        return label;
    }
}
