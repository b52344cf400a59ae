package com.vidnyan.heuristic.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Violation severity levels, ordered by rank.
 */
public enum Severity {
    HIGH(3),    // Blocks the primary task
    MEDIUM(2),  // Noticeably degrades the experience
    LOW(1);     // Polish

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
