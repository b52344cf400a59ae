package com.vidnyan.heuristic.domain.rule;

import com.vidnyan.heuristic.domain.feature.FeatureKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.vidnyan.heuristic.domain.rule.Category.ACCESSIBILITY;
import static com.vidnyan.heuristic.domain.rule.Category.CTA_VISIBILITY;
import static com.vidnyan.heuristic.domain.rule.Category.FORM_UX;
import static com.vidnyan.heuristic.domain.rule.Category.INFORMATION_ARCHITECTURE;
import static com.vidnyan.heuristic.domain.rule.Category.PERFORMANCE;
import static com.vidnyan.heuristic.domain.rule.Category.READABILITY;

/**
 * Static catalog of heuristic rules, grouped by category in declaration order.
 *
 * <p>Declaration order matters: violations are reported in this order and it
 * breaks ties between same-severity recommendations.
 */
public final class RuleCatalog {

    private static final Map<Category, List<RuleDefinition>> RULES = new EnumMap<>(Category.class);

    static {
        register(INFORMATION_ARCHITECTURE,
                RuleDefinition.builder()
                        .id("ia_001")
                        .description("The page has no H1 heading")
                        .severity(Severity.HIGH)
                        .scoreImpact(-5)
                        .recommendation("Give the page a single descriptive H1 heading")
                        .when(f -> !f.bool(FeatureKey.HAS_H1)),
                RuleDefinition.builder()
                        .id("ia_002")
                        .description("The page has more than one H1 heading")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-3)
                        .recommendation("Keep to one H1 heading per page")
                        .when(f -> f.bool(FeatureKey.MULTIPLE_H1)),
                RuleDefinition.builder()
                        .id("ia_003")
                        .description("The heading hierarchy skips levels or does not start at H1")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Structure headings as a proper hierarchy (H1 -> H2 -> H3)")
                        .when(f -> !f.list(FeatureKey.HIERARCHY_ISSUES).isEmpty()),
                RuleDefinition.builder()
                        .id("ia_004")
                        .description("No breadcrumb navigation was found")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Add breadcrumb navigation so users can see where they are")
                        .when(f -> !f.bool(FeatureKey.HAS_BREADCRUMBS)),
                RuleDefinition.builder()
                        .id("ia_005")
                        .description("Too many links share the same text")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-3)
                        .recommendation("Consolidate links with identical text and make each one distinguishable")
                        .when(f -> f.number(FeatureKey.DUPLICATE_LINK_TEXTS) > 5));

        register(CTA_VISIBILITY,
                RuleDefinition.builder()
                        .id("cta_001")
                        .description("No call to action was found above the fold")
                        .severity(Severity.HIGH)
                        .scoreImpact(-8)
                        .recommendation("Place the primary call to action in the area visible without scrolling")
                        .when(f -> !f.bool(FeatureKey.HAS_CTA_ABOVE_FOLD)),
                RuleDefinition.builder()
                        .id("cta_002")
                        .description("No clear button text was detected")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-5)
                        .recommendation("Use buttons labelled with a clear action such as \"Buy\", \"Apply\" or \"Sign up\"")
                        .when(f -> f.list(FeatureKey.BUTTON_TEXTS).isEmpty()),
                RuleDefinition.builder()
                        .id("cta_003")
                        .description("Overall contrast is insufficient")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Increase the contrast of buttons and other key elements")
                        .when(f -> !f.bool(FeatureKey.HAS_GOOD_CONTRAST)),
                RuleDefinition.builder()
                        .id("cta_004")
                        .description("Few visually identifiable buttons were found")
                        .severity(Severity.LOW)
                        .scoreImpact(-3)
                        .recommendation("Make buttons stand out visually from the surrounding content")
                        .when(f -> f.number(FeatureKey.BUTTON_CANDIDATES) < 2));

        register(READABILITY,
                RuleDefinition.builder()
                        .id("read_001")
                        .description("The page has no title")
                        .severity(Severity.HIGH)
                        .scoreImpact(-5)
                        .recommendation("Set a descriptive page title")
                        .when(f -> f.number(FeatureKey.TITLE_LENGTH) == 0),
                RuleDefinition.builder()
                        .id("read_002")
                        .description("The page title is too long")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Keep the page title within 60 characters")
                        .when(f -> f.number(FeatureKey.TITLE_LENGTH) > 60),
                RuleDefinition.builder()
                        .id("read_003")
                        .description("The page has no meta description")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-3)
                        .recommendation("Add a meta description for search result snippets")
                        .when(f -> f.number(FeatureKey.DESCRIPTION_LENGTH) == 0),
                RuleDefinition.builder()
                        .id("read_004")
                        .description("Paragraphs are too long")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Split long paragraphs into shorter, easier to read blocks")
                        .when(f -> f.number(FeatureKey.AVG_PARAGRAPH_LENGTH) > 200),
                RuleDefinition.builder()
                        .id("read_005")
                        .description("The page is visually too dense")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Reduce visual clutter and group related elements")
                        .when(f -> f.bool(FeatureKey.IS_CLUTTERED)),
                RuleDefinition.builder()
                        .id("read_006")
                        .description("There is not enough whitespace")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Add more whitespace between elements to improve readability")
                        .when(f -> !f.bool(FeatureKey.HAS_SUFFICIENT_WHITESPACE)));

        register(FORM_UX,
                RuleDefinition.builder()
                        .id("form_001")
                        .description("{unlabeled_count} input fields have no label")
                        .severity(Severity.HIGH)
                        .scoreImpact(-6)
                        .recommendation("Give every input field a proper label")
                        .when(f -> f.number(FeatureKey.UNLABELED_COUNT) > 0),
                RuleDefinition.builder()
                        .id("form_002")
                        .description("No mechanism for showing error messages was found")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Show clear error messages when input is invalid")
                        .when(f -> !f.bool(FeatureKey.HAS_ERROR_HANDLING)),
                RuleDefinition.builder()
                        .id("form_003")
                        .description("Required fields are not marked")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Mark required fields clearly (an asterisk or the required attribute)")
                        .when(f -> f.number(FeatureKey.REQUIRED_FIELDS) == 0
                                && f.number(FeatureKey.INPUT_COUNT) > 2),
                RuleDefinition.builder()
                        .id("form_004")
                        .description("Input fields may be hard to identify visually")
                        .severity(Severity.LOW)
                        .scoreImpact(-3)
                        .recommendation("Give input fields a visible border or background")
                        .when(f -> f.number(FeatureKey.INPUT_CANDIDATES) < f.number(FeatureKey.INPUT_COUNT) * 0.5));

        register(ACCESSIBILITY,
                RuleDefinition.builder()
                        .id("a11y_001")
                        .description("Images are missing alt text")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Provide meaningful alt text for every image")
                        .when(f -> f.number(FeatureKey.ALT_TEXT_COVERAGE) < 0.8),
                RuleDefinition.builder()
                        .id("a11y_002")
                        .description("No ARIA attributes are used")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Use ARIA attributes to support screen readers")
                        .when(f -> f.number(FeatureKey.ARIA_ELEMENTS_COUNT) == 0),
                RuleDefinition.builder()
                        .id("a11y_003")
                        .description("No landmark roles are set")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Declare landmark roles such as main, navigation and banner")
                        .when(f -> f.number(FeatureKey.LANDMARK_ROLES_COUNT) == 0),
                RuleDefinition.builder()
                        .id("a11y_004")
                        .description("The contrast ratio is insufficient")
                        .severity(Severity.MEDIUM)
                        .scoreImpact(-4)
                        .recommendation("Ensure a contrast ratio of at least 4.5:1 (WCAG AA)")
                        .when(f -> f.bool(FeatureKey.IS_LOW_CONTRAST)));

        register(PERFORMANCE,
                RuleDefinition.builder()
                        .id("perf_001")
                        .description("No structured data is present")
                        .severity(Severity.LOW)
                        .scoreImpact(-1)
                        .recommendation("Add structured data in JSON-LD format")
                        .when(f -> f.number(FeatureKey.STRUCTURED_DATA_COUNT) == 0),
                RuleDefinition.builder()
                        .id("perf_002")
                        .description("The page has many images, which may slow down loading")
                        .severity(Severity.LOW)
                        .scoreImpact(-2)
                        .recommendation("Optimize images (compression, WebP format)")
                        .when(f -> f.number(FeatureKey.TOTAL_IMAGES) > 10),
                RuleDefinition.builder()
                        .id("perf_003")
                        .description("No Open Graph image is set")
                        .severity(Severity.LOW)
                        .scoreImpact(-1)
                        .recommendation("Set an Open Graph image for social sharing previews")
                        .when(f -> !f.bool(FeatureKey.HAS_OG_IMAGE)));

        verify();
    }

    private RuleCatalog() {
    }

    /**
     * Rules of one category, in declaration order.
     */
    public static List<RuleDefinition> forCategory(Category category) {
        return RULES.getOrDefault(category, List.of());
    }

    /**
     * All rules, in category order then declaration order.
     */
    public static List<RuleDefinition> all() {
        List<RuleDefinition> all = new ArrayList<>();
        RULES.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    static Optional<RuleDefinition> findById(String ruleId) {
        return all().stream()
                .filter(r -> r.id().equals(ruleId))
                .findFirst();
    }

    private static void register(Category category, RuleDefinition.Builder... builders) {
        List<RuleDefinition> rules = new ArrayList<>(builders.length);
        for (RuleDefinition.Builder builder : builders) {
            rules.add(builder.category(category).build());
        }
        RULES.put(category, List.copyOf(rules));
    }

    private static void verify() {
        Set<String> ids = new HashSet<>();
        Set<String> recommendations = new HashSet<>();
        for (RuleDefinition rule : all()) {
            if (!ids.add(rule.id())) {
                throw new IllegalStateException("Duplicate rule id: " + rule.id());
            }
            if (!recommendations.add(rule.recommendation())) {
                throw new IllegalStateException("Duplicate recommendation text in rule " + rule.id());
            }
        }
        for (Category category : Category.values()) {
            if (!RULES.containsKey(category)) {
                throw new IllegalStateException("No rules registered for " + category.key());
            }
        }
    }
}
