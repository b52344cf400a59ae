package com.vidnyan.heuristic.domain.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A rule that fired during one evaluation.
 * Immutable value object.
 */
@JsonPropertyOrder({"rule_id", "category", "description", "severity", "passed", "score_impact", "recommendation"})
public record RuleViolation(
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("category") Category category,
    @JsonProperty("description") String description,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("passed") boolean passed,
    @JsonProperty("score_impact") int scoreImpact,
    @JsonProperty("recommendation") String recommendation
) {
}
