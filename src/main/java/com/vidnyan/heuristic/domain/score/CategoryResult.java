package com.vidnyan.heuristic.domain.score;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.rule.RuleViolation;

import java.util.List;
import java.util.Objects;

/**
 * One category's clamped score and the violations that produced it.
 * The score is always within {@code [0, maxScore]}.
 */
@JsonPropertyOrder({"score", "max_score", "rules"})
public record CategoryResult(
    @JsonIgnore Category category,
    @JsonProperty("score") int score,
    @JsonProperty("max_score") int maxScore,
    @JsonProperty("rules") List<RuleViolation> violations
) {

    public CategoryResult {
        Objects.requireNonNull(category, "category");
        if (maxScore != category.maxScore()) {
            throw new IllegalArgumentException(String.format(
                    "Max score %d does not match %s maximum %d", maxScore, category.key(), category.maxScore()));
        }
        if (score < 0 || score > maxScore) {
            throw new IllegalArgumentException(String.format(
                    "Score %d for %s is outside [0, %d]", score, category.key(), maxScore));
        }
        violations = List.copyOf(violations);
    }

    /**
     * Fold violations into a score: the category maximum plus every impact, floored at zero.
     */
    public static CategoryResult scored(Category category, List<RuleViolation> violations) {
        int raw = category.maxScore() + violations.stream()
                .mapToInt(RuleViolation::scoreImpact)
                .sum();
        return new CategoryResult(category, Math.max(0, raw), category.maxScore(), violations);
    }

    /**
     * Full marks with no violations, for a category that does not apply to the page.
     */
    public static CategoryResult fullMarks(Category category) {
        return new CategoryResult(category, category.maxScore(), category.maxScore(), List.of());
    }

    /**
     * Score as a percentage of the category maximum.
     */
    public double percentage() {
        return score * 100.0 / maxScore;
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
