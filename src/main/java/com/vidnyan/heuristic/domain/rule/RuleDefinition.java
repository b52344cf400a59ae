package com.vidnyan.heuristic.domain.rule;

import com.vidnyan.heuristic.domain.feature.FeatureKey;
import com.vidnyan.heuristic.domain.feature.FeatureMap;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Rule definition - a static heuristic check and the penalty it carries.
 * Immutable value object, created once in {@link RuleCatalog}.
 *
 * <p>The description may contain {@code {feature_name}} placeholders which are
 * filled from the feature map when the rule fires.
 */
public record RuleDefinition(
    String id,
    Category category,
    String description,
    Severity severity,
    int scoreImpact,
    String recommendation,
    Predicate<FeatureMap> trigger
) {

    public RuleDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id is required");
        }
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(trigger, "trigger");
        if (scoreImpact >= 0 || -scoreImpact > category.maxScore()) {
            throw new IllegalArgumentException(String.format(
                    "Rule %s: score impact %d must be negative and within the %s maximum of %d",
                    id, scoreImpact, category.key(), category.maxScore()));
        }
    }

    /**
     * Check whether the rule's trigger condition holds for the given features.
     */
    public boolean firesOn(FeatureMap features) {
        return trigger.test(features);
    }

    /**
     * Instantiate this rule as a violation for one evaluation run.
     */
    public RuleViolation toViolation(FeatureMap features) {
        return new RuleViolation(id, category, describe(features), severity, false,
                scoreImpact, recommendation);
    }

    /**
     * Format the description with feature placeholders.
     */
    String describe(FeatureMap features) {
        String result = description;
        if (result.indexOf('{') < 0) {
            return result;
        }
        for (FeatureKey key : FeatureKey.values()) {
            result = result.replace("{" + key.featureName() + "}",
                    String.valueOf(features.value(key)));
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private Category category;
        private String description;
        private Severity severity = Severity.MEDIUM;
        private int scoreImpact;
        private String recommendation;
        private Predicate<FeatureMap> trigger;

        public Builder id(String id) { this.id = id; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder scoreImpact(int impact) { this.scoreImpact = impact; return this; }
        public Builder recommendation(String rec) { this.recommendation = rec; return this; }
        public Builder when(Predicate<FeatureMap> trigger) { this.trigger = trigger; return this; }

        public RuleDefinition build() {
            return new RuleDefinition(id, category, description, severity, scoreImpact,
                    recommendation, trigger);
        }
    }
}
