package com.vidnyan.heuristic.adapter.out.evaluator;

import com.vidnyan.heuristic.domain.feature.FeatureKey;
import com.vidnyan.heuristic.domain.feature.FeatureMap;
import com.vidnyan.heuristic.domain.rule.Category;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Scores form labelling, error feedback and field visibility.
 * Pages without forms get full marks.
 */
@Component
@Order(40)
public class FormUxEvaluator extends AbstractCategoryEvaluator {

    public FormUxEvaluator() {
        super(Category.FORM_UX);
    }

    @Override
    protected boolean isApplicable(FeatureMap features) {
        return features.number(FeatureKey.FORM_COUNT) > 0;
    }
}
