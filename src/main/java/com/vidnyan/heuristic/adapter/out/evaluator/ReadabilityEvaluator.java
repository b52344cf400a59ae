package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.rule.Category;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores page metadata, paragraph length and visual density.
 */
@Component
@Order(30)
public class ReadabilityEvaluator extends AbstractCategoryEvaluator {

    public ReadabilityEvaluator() {
        super(Category.READABILITY);
    }
}
