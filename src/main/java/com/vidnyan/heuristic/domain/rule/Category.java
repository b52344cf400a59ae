package com.vidnyan.heuristic.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Weighted scoring dimensions. Declaration order is the fixed category order
 * used for evaluation, reporting and recommendation tie-breaks.
 */
public enum Category {
    INFORMATION_ARCHITECTURE("information_architecture", 30),
    CTA_VISIBILITY("cta_visibility", 20),
    READABILITY("readability", 20),
    FORM_UX("form_ux", 15),
    ACCESSIBILITY("accessibility", 10),
    PERFORMANCE("performance", 5);

    private final String key;
    private final int maxScore;

    Category(String key, int maxScore) {
        this.key = key;
        this.maxScore = maxScore;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int maxScore() {
        return maxScore;
    }

    /**
     * Sum of all category maxima.
     */
    public static int totalMaxScore() {
        return Arrays.stream(values()).mapToInt(Category::maxScore).sum();
    }

    public static Category fromKey(String key) {
        return Arrays.stream(values())
                .filter(c -> c.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + key));
    }
}
