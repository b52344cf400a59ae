package com.vidnyan.heuristic.domain.summary;

import com.vidnyan.heuristic.domain.score.AnalysisScoreReport;

import java.util.Comparator;
import java.util.List;

/**
 * Derives tier, strengths and weaknesses from a report.
 */
public class SummaryClassifier {

    public static final double STRENGTH_THRESHOLD = 70.0;
    public static final double WEAKNESS_THRESHOLD = 50.0;
    public static final int MAX_HIGHLIGHTS = 3;
    public static final int TOP_RECOMMENDATIONS = 5;

    public SummaryView classify(AnalysisScoreReport report) {
        // Stable sort: equal percentages keep category order
        List<CategoryStanding> byPercentage = report.categoryResults().stream()
                .map(CategoryStanding::of)
                .sorted(Comparator.comparingDouble(CategoryStanding::percentage).reversed())
                .toList();

        List<CategoryStanding> strengths = byPercentage.stream()
                .filter(s -> s.percentage() >= STRENGTH_THRESHOLD)
                .limit(MAX_HIGHLIGHTS)
                .toList();

        // Taken from the same descending list, so these are the best of the weak categories
        List<CategoryStanding> weaknesses = byPercentage.stream()
                .filter(s -> s.percentage() < WEAKNESS_THRESHOLD)
                .limit(MAX_HIGHLIGHTS)
                .toList();

        List<String> topRecommendations = report.recommendations().stream()
                .limit(TOP_RECOMMENDATIONS)
                .toList();

        return new SummaryView(report.totalScore(), ScoreTier.forScore(report.totalScore()),
                strengths, weaknesses, topRecommendations);
    }
}
