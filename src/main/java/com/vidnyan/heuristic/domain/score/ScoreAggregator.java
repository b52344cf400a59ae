package com.vidnyan.heuristic.domain.score;

import com.vidnyan.heuristic.domain.recommendation.RecommendationRanker;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.rule.RuleViolation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the six category results into a report.
 *
 * <p>The total is a plain sum. It stays within [0, 100] because every category
 * is clamped to its own maximum and the maxima sum to 100; the total itself is
 * never clamped.
 */
public class ScoreAggregator {

    private final RecommendationRanker recommendationRanker;

    public ScoreAggregator(RecommendationRanker recommendationRanker) {
        this.recommendationRanker = recommendationRanker;
    }

    /**
     * Aggregate results; exactly one result per category is required.
     */
    public AnalysisScoreReport aggregate(List<CategoryResult> results) {
        Map<Category, CategoryResult> byCategory = new EnumMap<>(Category.class);
        for (CategoryResult result : results) {
            if (byCategory.put(result.category(), result) != null) {
                throw new IllegalArgumentException("Duplicate result for " + result.category().key());
            }
        }
        for (Category category : Category.values()) {
            if (!byCategory.containsKey(category)) {
                throw new IllegalArgumentException("Missing result for " + category.key());
            }
        }

        // EnumMap iterates in category order
        List<CategoryResult> ordered = new ArrayList<>(byCategory.values());
        int total = ordered.stream().mapToInt(CategoryResult::score).sum();

        List<RuleViolation> violations = ordered.stream()
                .flatMap(r -> r.violations().stream())
                .toList();

        return new AnalysisScoreReport(total, ordered, recommendationRanker.rank(violations));
    }
}
