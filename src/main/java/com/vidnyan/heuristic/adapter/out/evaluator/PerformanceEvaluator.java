package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.rule.Category;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores lightweight performance and sharing signals.
 */
@Component
@Order(60)
public class PerformanceEvaluator extends AbstractCategoryEvaluator {

    public PerformanceEvaluator() {
        super(Category.PERFORMANCE);
    }
}
