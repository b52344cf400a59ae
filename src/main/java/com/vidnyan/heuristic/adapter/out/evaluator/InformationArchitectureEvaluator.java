package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.rule.Category;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores heading structure and navigation aids.
 */
@Component
@Order(10)
public class InformationArchitectureEvaluator extends AbstractCategoryEvaluator {

    public InformationArchitectureEvaluator() {
        super(Category.INFORMATION_ARCHITECTURE);
    }
}
