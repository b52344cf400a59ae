package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.rule.Category;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores alt text, ARIA usage, landmarks and contrast.
 */
@Component
@Order(50)
public class AccessibilityEvaluator extends AbstractCategoryEvaluator {

    public AccessibilityEvaluator() {
        super(Category.ACCESSIBILITY);
    }
}
