package com.vidnyan.heuristic.domain.score;

import com.vidnyan.heuristic.FeatureFixtures;
import com.vidnyan.heuristic.domain.feature.FeatureKey;
import com.vidnyan.heuristic.domain.feature.FeatureMap;
import com.vidnyan.heuristic.domain.recommendation.RecommendationRanker;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.rule.RuleViolation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator(new RecommendationRanker());

    @Test
    void cleanPage_ShouldScoreOneHundredWithGenericRecommendations() {
        AnalysisScoreReport report = aggregator.aggregate(evaluate(FeatureFixtures.cleanPage().build()));

        assertEquals(100, report.totalScore());
        assertTrue(report.violations().isEmpty());
        assertEquals(RecommendationRanker.GENERIC_RECOMMENDATIONS, report.recommendations());
    }

    @Test
    void total_ShouldBeTheSumOfCategoryScores() {
        FeatureMap features = FeatureFixtures.cleanPage()
                .set(FeatureKey.HAS_H1, false)
                .set(FeatureKey.HAS_BREADCRUMBS, false)
                .set(FeatureKey.IS_CLUTTERED, true)
                .build();

        AnalysisScoreReport report = aggregator.aggregate(evaluate(features));

        assertEquals(100 - 5 - 2 - 4, report.totalScore());
        assertEquals(23, report.categoryScores().get("information_architecture"));
        assertEquals(16, report.categoryScores().get("readability"));
        assertEquals(List.of("ia_001", "ia_004", "read_005"),
                report.violations().stream().map(RuleViolation::ruleId).toList());
    }

    @Test
    void results_ShouldBeReorderedIntoCategoryOrder() {
        List<CategoryResult> shuffled = new ArrayList<>(evaluate(FeatureMap.empty()));
        Collections.reverse(shuffled);

        AnalysisScoreReport report = aggregator.aggregate(shuffled);

        assertEquals(List.of(Category.values()),
                report.categoryResults().stream().map(CategoryResult::category).toList());
        assertEquals(List.of("information_architecture", "cta_visibility", "readability", "form_ux",
                "accessibility", "performance"), new ArrayList<>(report.categoryScores().keySet()));
    }

    @Test
    void missingOrDuplicateCategory_ShouldBeRejected() {
        List<CategoryResult> results = evaluate(FeatureMap.empty());

        assertThrows(IllegalArgumentException.class, () -> aggregator.aggregate(results.subList(0, 5)));

        List<CategoryResult> duplicated = new ArrayList<>(results);
        duplicated.add(results.get(0));
        assertThrows(IllegalArgumentException.class, () -> aggregator.aggregate(duplicated));
    }

    @Test
    void categoryResult_ShouldRejectScoresOutsideItsRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new CategoryResult(Category.PERFORMANCE, 6, 5, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new CategoryResult(Category.PERFORMANCE, -1, 5, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new CategoryResult(Category.PERFORMANCE, 5, 10, List.of()));
    }

    @Test
    void randomFeatureMaps_ShouldStayWithinBounds() {
        Random random = new Random(42);

        for (int i = 0; i < 500; i++) {
            FeatureMap features = randomFeatures(random);
            AnalysisScoreReport report = aggregator.aggregate(evaluate(features));

            assertTrue(report.totalScore() >= 0 && report.totalScore() <= 100, features.toString());
            for (CategoryResult result : report.categoryResults()) {
                assertTrue(result.score() >= 0 && result.score() <= result.maxScore(), features.toString());
            }
            assertTrue(report.recommendations().size() >= 3);
            assertTrue(report.recommendations().size() <= 10);
            assertEquals(report.recommendations().size(), new HashSet<>(report.recommendations()).size());
            assertEquals(report, aggregator.aggregate(evaluate(features)));
        }
    }

    @Test
    void worstPage_ShouldStillProduceANonNegativeTotal() {
        AnalysisScoreReport report = aggregator.aggregate(evaluate(FeatureFixtures.worstPage().build()));

        // 13 + 0 + 2 + 0 + 0 + 1
        assertEquals(16, report.totalScore());
        assertEquals(10, report.recommendations().size());
    }

    private static List<CategoryResult> evaluate(FeatureMap features) {
        return FeatureFixtures.evaluators().stream()
                .map(evaluator -> evaluator.evaluate(features))
                .toList();
    }

    private static FeatureMap randomFeatures(Random random) {
        FeatureMap.Builder builder = FeatureMap.builder();
        for (FeatureKey key : FeatureKey.values()) {
            if (random.nextInt(4) == 0) {
                continue;
            }
            Object value = switch (key.type()) {
                case BOOLEAN -> random.nextBoolean();
                case INTEGER -> random.nextInt(15);
                case DECIMAL -> key == FeatureKey.ALT_TEXT_COVERAGE ? random.nextDouble() : random.nextDouble() * 400;
                case LIST -> random.nextBoolean() ? List.of() : List.of("item");
            };
            builder.set(key, value);
        }
        return builder.build();
    }
}
