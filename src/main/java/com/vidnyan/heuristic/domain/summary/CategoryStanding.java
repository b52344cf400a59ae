package com.vidnyan.heuristic.domain.summary;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.score.CategoryResult;

/**
 * A category's score relative to its maximum.
 */
public record CategoryStanding(
    @JsonProperty("category") Category category,
    @JsonProperty("score") int score,
    @JsonProperty("max_score") int maxScore,
    @JsonProperty("percentage") double percentage
) {

    public static CategoryStanding of(CategoryResult result) {
        return new CategoryStanding(result.category(), result.score(), result.maxScore(), result.percentage());
    }
}
