package com.vidnyan.heuristic.domain.rule;

import com.vidnyan.heuristic.domain.feature.FeatureMap;
import com.vidnyan.heuristic.domain.score.CategoryResult;

/**
 * Interface for category evaluators.
 * Each evaluator scores exactly one category.
 */
public interface CategoryEvaluator {

    /**
     * The category this evaluator scores.
     */
    Category category();

    /**
     * Apply the category's rules to the features.
     * Pure and total: never throws for any feature map.
     */
    CategoryResult evaluate(FeatureMap features);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
