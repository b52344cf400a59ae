package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.rule.Category;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores how visible and recognizable the calls to action are.
 */
@Component
@Order(20)
public class CtaVisibilityEvaluator extends AbstractCategoryEvaluator {

    public CtaVisibilityEvaluator() {
        super(Category.CTA_VISIBILITY);
    }
}
