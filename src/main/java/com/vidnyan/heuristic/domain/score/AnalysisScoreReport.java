package com.vidnyan.heuristic.domain.score;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.rule.RuleViolation;
import com.vidnyan.heuristic.domain.rule.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full scoring output for one page.
 * Category results are held in the fixed category order.
 */
@JsonPropertyOrder({"total_score", "categories", "recommendations", "category_details"})
public record AnalysisScoreReport(
    @JsonProperty("total_score") int totalScore,
    @JsonIgnore List<CategoryResult> categoryResults,
    @JsonProperty("recommendations") List<String> recommendations
) {

    public AnalysisScoreReport {
        categoryResults = List.copyOf(categoryResults);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Category name to score.
     */
    @JsonProperty("categories")
    public Map<String, Integer> categoryScores() {
        Map<String, Integer> scores = new LinkedHashMap<>();
        categoryResults.forEach(r -> scores.put(r.category().key(), r.score()));
        return Collections.unmodifiableMap(scores);
    }

    /**
     * Category name to score, maximum and fired rules.
     */
    @JsonProperty("category_details")
    public Map<String, CategoryResult> categoryDetails() {
        Map<String, CategoryResult> details = new LinkedHashMap<>();
        categoryResults.forEach(r -> details.put(r.category().key(), r));
        return Collections.unmodifiableMap(details);
    }

    /**
     * All violations in category order then rule declaration order.
     */
    @JsonIgnore
    public List<RuleViolation> violations() {
        return categoryResults.stream()
                .flatMap(r -> r.violations().stream())
                .toList();
    }

    public CategoryResult result(Category category) {
        return categoryResults.stream()
                .filter(r -> r.category() == category)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No result for " + category.key()));
    }

    public int violationCount(Severity severity) {
        return (int) violations().stream()
                .filter(v -> v.severity() == severity)
                .count();
    }
}
