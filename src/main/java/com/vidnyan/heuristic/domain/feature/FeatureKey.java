package com.vidnyan.heuristic.domain.feature;

import java.util.List;

/**
 * Schema of every feature value the rule catalog reads.
 * Each key fixes its namespace, section, type and the default used when the
 * value is absent. Defaults are permissive: only confirmed problems are penalized.
 */
public enum FeatureKey {

    // html.heading_analysis
    HAS_H1(FeatureNamespace.HTML, "heading_analysis", "has_h1", FeatureType.BOOLEAN, false),
    MULTIPLE_H1(FeatureNamespace.HTML, "heading_analysis", "multiple_h1", FeatureType.BOOLEAN, false),
    HIERARCHY_ISSUES(FeatureNamespace.HTML, "heading_analysis", "hierarchy_issues", FeatureType.LIST, List.of()),

    // html.navigation_analysis
    HAS_BREADCRUMBS(FeatureNamespace.HTML, "navigation_analysis", "has_breadcrumbs", FeatureType.BOOLEAN, false),
    DUPLICATE_LINK_TEXTS(FeatureNamespace.HTML, "navigation_analysis", "duplicate_link_texts", FeatureType.INTEGER, 0L),

    // html.form_analysis
    FORM_COUNT(FeatureNamespace.HTML, "form_analysis", "form_count", FeatureType.INTEGER, 0L),
    UNLABELED_COUNT(FeatureNamespace.HTML, "form_analysis", "unlabeled_count", FeatureType.INTEGER, 0L),
    HAS_ERROR_HANDLING(FeatureNamespace.HTML, "form_analysis", "has_error_handling", FeatureType.BOOLEAN, false),
    REQUIRED_FIELDS(FeatureNamespace.HTML, "form_analysis", "required_fields", FeatureType.INTEGER, 0L),
    INPUT_COUNT(FeatureNamespace.HTML, "form_analysis", "input_count", FeatureType.INTEGER, 1L),

    // html.accessibility_analysis
    ALT_TEXT_COVERAGE(FeatureNamespace.HTML, "accessibility_analysis", "alt_text_coverage", FeatureType.DECIMAL, 1.0),
    ARIA_ELEMENTS_COUNT(FeatureNamespace.HTML, "accessibility_analysis", "aria_elements_count", FeatureType.INTEGER, 0L),
    LANDMARK_ROLES_COUNT(FeatureNamespace.HTML, "accessibility_analysis", "landmark_roles_count", FeatureType.INTEGER, 0L),
    TOTAL_IMAGES(FeatureNamespace.HTML, "accessibility_analysis", "total_images", FeatureType.INTEGER, 0L),

    // html.meta_analysis
    TITLE_LENGTH(FeatureNamespace.HTML, "meta_analysis", "title_length", FeatureType.INTEGER, 0L),
    DESCRIPTION_LENGTH(FeatureNamespace.HTML, "meta_analysis", "description_length", FeatureType.INTEGER, 0L),
    STRUCTURED_DATA_COUNT(FeatureNamespace.HTML, "meta_analysis", "structured_data_count", FeatureType.INTEGER, 0L),
    HAS_OG_IMAGE(FeatureNamespace.HTML, "meta_analysis", "has_og_image", FeatureType.BOOLEAN, false),

    // html.content_analysis
    AVG_PARAGRAPH_LENGTH(FeatureNamespace.HTML, "content_analysis", "avg_paragraph_length", FeatureType.DECIMAL, 0.0),

    // image.*
    HAS_CTA_ABOVE_FOLD(FeatureNamespace.IMAGE, "above_fold_analysis", "has_cta_above_fold", FeatureType.BOOLEAN, false),
    BUTTON_TEXTS(FeatureNamespace.IMAGE, "ocr_analysis", "button_texts", FeatureType.LIST, List.of()),
    HAS_GOOD_CONTRAST(FeatureNamespace.IMAGE, "contrast_analysis", "has_good_contrast", FeatureType.BOOLEAN, true),
    IS_LOW_CONTRAST(FeatureNamespace.IMAGE, "contrast_analysis", "is_low_contrast", FeatureType.BOOLEAN, false),
    IS_CLUTTERED(FeatureNamespace.IMAGE, "visual_density", "is_cluttered", FeatureType.BOOLEAN, false),
    HAS_SUFFICIENT_WHITESPACE(FeatureNamespace.IMAGE, "visual_density", "has_sufficient_whitespace", FeatureType.BOOLEAN, true),
    BUTTON_CANDIDATES(FeatureNamespace.IMAGE, "element_detection", "button_candidates", FeatureType.INTEGER, 0L),
    INPUT_CANDIDATES(FeatureNamespace.IMAGE, "element_detection", "input_candidates", FeatureType.INTEGER, 0L);

    /**
     * Value types a feature can carry.
     */
    public enum FeatureType {
        BOOLEAN,
        INTEGER,
        DECIMAL,
        LIST
    }

    private final FeatureNamespace namespace;
    private final String section;
    private final String name;
    private final FeatureType type;
    private final Object defaultValue;

    FeatureKey(FeatureNamespace namespace, String section, String name, FeatureType type, Object defaultValue) {
        this.namespace = namespace;
        this.section = section;
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public FeatureNamespace namespace() {
        return namespace;
    }

    public String section() {
        return section;
    }

    /**
     * Key name inside its section, e.g. {@code has_h1}.
     */
    public String featureName() {
        return name;
    }

    public FeatureType type() {
        return type;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    /**
     * Dotted path, e.g. {@code html.heading_analysis.has_h1}.
     */
    public String path() {
        return namespace.key() + "." + section + "." + name;
    }
}
