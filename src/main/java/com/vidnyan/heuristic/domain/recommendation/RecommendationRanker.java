package com.vidnyan.heuristic.domain.recommendation;

import com.vidnyan.heuristic.domain.rule.RuleViolation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns fired violations into an ordered, de-duplicated list of recommendations.
 *
 * <p>Input violations must already be in category order then rule declaration
 * order; the sort is stable, so that order breaks severity ties.
 */
public class RecommendationRanker {

    public static final int MAX_RECOMMENDATIONS = 10;
    public static final int MIN_RECOMMENDATIONS = 3;

    /**
     * Generic advice used to pad a short list.
     */
    public static final List<String> GENERIC_RECOMMENDATIONS = List.of(
            "Improve the contrast ratio across the whole page",
            "Place the most important information near the top of the page",
            "Make the navigation more intuitive"
    );

    private final List<String> genericPool;

    public RecommendationRanker() {
        this(GENERIC_RECOMMENDATIONS);
    }

    public RecommendationRanker(List<String> genericPool) {
        this.genericPool = List.copyOf(genericPool);
    }

    public List<String> rank(List<RuleViolation> violations) {
        return rank(violations, genericPool);
    }

    /**
     * Rank violations by severity and backfill from the pool when fewer than
     * {@value #MIN_RECOMMENDATIONS} remain.
     */
    public List<String> rank(List<RuleViolation> violations, List<String> pool) {
        List<String> ranked = violations.stream()
                .filter(v -> !v.passed())
                .sorted(Comparator.comparingInt((RuleViolation v) -> v.severity().rank()).reversed())
                .map(RuleViolation::recommendation)
                .distinct()
                .limit(MAX_RECOMMENDATIONS)
                .toList();

        if (ranked.size() >= MIN_RECOMMENDATIONS) {
            return ranked;
        }

        List<String> padded = new ArrayList<>(ranked);
        for (String generic : pool) {
            if (padded.size() >= MIN_RECOMMENDATIONS || padded.size() >= MAX_RECOMMENDATIONS) {
                break;
            }
            if (!padded.contains(generic)) {
                padded.add(generic);
            }
        }
        return List.copyOf(padded);
    }
}
