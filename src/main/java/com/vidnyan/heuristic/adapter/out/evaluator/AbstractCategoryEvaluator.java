package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.feature.FeatureMap;
import com.vidnyan.heuristic.domain.rule.Category;
import com.vidnyan.heuristic.domain.rule.CategoryEvaluator;
import com.vidnyan.heuristic.domain.rule.RuleCatalog;
import com.vidnyan.heuristic.domain.rule.RuleDefinition;
import com.vidnyan.heuristic.domain.rule.RuleViolation;
import com.vidnyan.heuristic.domain.score.CategoryResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Shared evaluation routine for all categories.
 * Runs the category's catalog rules in declaration order and folds the fired
 * impacts into a clamped score. Subclasses only pick the category and may
 * restrict when it applies.
 */
@Slf4j
public abstract class AbstractCategoryEvaluator implements CategoryEvaluator {

    private final Category category;
    private final List<RuleDefinition> rules;

    protected AbstractCategoryEvaluator(Category category) {
        this.category = category;
        this.rules = RuleCatalog.forCategory(category);
    }

    @Override
    public final Category category() {
        return category;
    }

    @Override
    public final CategoryResult evaluate(FeatureMap features) {
        if (!isApplicable(features)) {
            log.debug("{} not applicable, awarding full {} points", category.key(), category.maxScore());
            return CategoryResult.fullMarks(category);
        }

        List<RuleViolation> violations = rules.stream()
                .filter(rule -> rule.firesOn(features))
                .map(rule -> rule.toViolation(features))
                .toList();

        CategoryResult result = CategoryResult.scored(category, violations);
        log.debug("{}: {}/{} with {} violations", category.key(), result.score(),
                result.maxScore(), violations.size());
        return result;
    }

    /**
     * Whether the category's rules apply to this page at all.
     */
    protected boolean isApplicable(FeatureMap features) {
        return true;
    }
}
