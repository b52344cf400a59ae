package com.vidnyan.heuristic.domain.summary;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative bucket of a total score.
 */
public enum ScoreTier {
    EXCELLENT(80, "Excellent"),
    GOOD(60, "Good"),
    FAIR(40, "Fair"),
    POOR(0, "Needs improvement");

    private final int minScore;
    private final String message;

    ScoreTier(int minScore, String message) {
        this.minScore = minScore;
        this.message = message;
    }

    public int minScore() {
        return minScore;
    }

    public String message() {
        return message;
    }

    @JsonValue
    public String level() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScoreTier forScore(int totalScore) {
        for (ScoreTier tier : values()) {
            if (totalScore >= tier.minScore) {
                return tier;
            }
        }
        return POOR;
    }
}
