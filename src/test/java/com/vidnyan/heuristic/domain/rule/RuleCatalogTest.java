package com.vidnyan.heuristic.domain.rule;

import com.vidnyan.heuristic.domain.feature.FeatureKey;
import com.vidnyan.heuristic.domain.feature.FeatureMap;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleCatalogTest {

    @Test
    void categoryMaxima_ShouldSumToOneHundred() {
        assertEquals(100, Category.totalMaxScore());
        assertEquals(30, Category.INFORMATION_ARCHITECTURE.maxScore());
        assertEquals(20, Category.CTA_VISIBILITY.maxScore());
        assertEquals(20, Category.READABILITY.maxScore());
        assertEquals(15, Category.FORM_UX.maxScore());
        assertEquals(10, Category.ACCESSIBILITY.maxScore());
        assertEquals(5, Category.PERFORMANCE.maxScore());
    }

    @Test
    void rules_ShouldKeepDeclarationOrderPerCategory() {
        assertEquals(List.of("ia_001", "ia_002", "ia_003", "ia_004", "ia_005"),
                ids(Category.INFORMATION_ARCHITECTURE));
        assertEquals(List.of("cta_001", "cta_002", "cta_003", "cta_004"), ids(Category.CTA_VISIBILITY));
        assertEquals(List.of("read_001", "read_002", "read_003", "read_004", "read_005", "read_006"),
                ids(Category.READABILITY));
        assertEquals(List.of("form_001", "form_002", "form_003", "form_004"), ids(Category.FORM_UX));
        assertEquals(List.of("a11y_001", "a11y_002", "a11y_003", "a11y_004"), ids(Category.ACCESSIBILITY));
        assertEquals(List.of("perf_001", "perf_002", "perf_003"), ids(Category.PERFORMANCE));
    }

    @Test
    void all_ShouldListCategoriesInFixedOrder() {
        List<RuleDefinition> all = RuleCatalog.all();

        assertEquals(26, all.size());
        assertEquals("ia_001", all.get(0).id());
        assertEquals("perf_003", all.get(all.size() - 1).id());
    }

    @Test
    void rules_ShouldHaveUniqueIdsAndBoundedNegativeImpacts() {
        Set<String> ids = new HashSet<>();
        for (RuleDefinition rule : RuleCatalog.all()) {
            assertTrue(ids.add(rule.id()), "duplicate id " + rule.id());
            assertTrue(rule.scoreImpact() < 0, rule.id());
            assertTrue(-rule.scoreImpact() <= rule.category().maxScore(), rule.id());
            assertFalse(rule.recommendation().isBlank(), rule.id());
        }
    }

    @Test
    void findById_ShouldReturnTheCatalogRule() {
        RuleDefinition rule = RuleCatalog.findById("cta_001").orElseThrow();

        assertEquals(Category.CTA_VISIBILITY, rule.category());
        assertEquals(Severity.HIGH, rule.severity());
        assertEquals(-8, rule.scoreImpact());
        assertTrue(RuleCatalog.findById("nope_001").isEmpty());
    }

    @Test
    void impactLargerThanCategoryMaximum_ShouldBeRejected() {
        RuleDefinition.Builder builder = RuleDefinition.builder()
                .id("perf_999")
                .category(Category.PERFORMANCE)
                .description("Too heavy")
                .scoreImpact(-6)
                .recommendation("Lighten up")
                .when(f -> true);

        assertThrows(IllegalArgumentException.class, builder::build);
        assertThrows(IllegalArgumentException.class, () -> builder.scoreImpact(0).build());
    }

    @Test
    void toViolation_ShouldFillDescriptionPlaceholders() {
        RuleDefinition rule = RuleCatalog.findById("form_001").orElseThrow();
        FeatureMap features = FeatureMap.builder()
                .set(FeatureKey.FORM_COUNT, 1)
                .set(FeatureKey.UNLABELED_COUNT, 4)
                .build();

        RuleViolation violation = rule.toViolation(features);

        assertEquals("4 input fields have no label", violation.description());
        assertEquals("form_001", violation.ruleId());
        assertFalse(violation.passed());
        assertEquals(-6, violation.scoreImpact());
        assertEquals(Severity.HIGH, violation.severity());
    }

    @Test
    void severities_ShouldBeRankedHighToLow() {
        assertEquals(3, Severity.HIGH.rank());
        assertEquals(2, Severity.MEDIUM.rank());
        assertEquals(1, Severity.LOW.rank());
        assertEquals("medium", Severity.MEDIUM.label());
    }

    private static List<String> ids(Category category) {
        return RuleCatalog.forCategory(category).stream().map(RuleDefinition::id).toList();
    }
}
