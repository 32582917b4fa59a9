package com.measurelog.common.entity;

import java.util.Arrays;

/**
 * Per-row embedding lifecycle: pending → processing → {completed | failed}.
 * Stored as the lower-case {@link #getValue() value}.
 */
public enum EmbeddingStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    EmbeddingStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static EmbeddingStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown embedding status: " + value));
    }
}
