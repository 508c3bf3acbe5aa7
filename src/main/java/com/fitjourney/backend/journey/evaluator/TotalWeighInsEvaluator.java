package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import org.springframework.stereotype.Component;

@Component
public class TotalWeighInsEvaluator implements ConditionEvaluator {

    static final double DEFAULT_TARGET = 10;

    private final ActivityQueryClient queries;

    public TotalWeighInsEvaluator(ActivityQueryClient queries) {
        this.queries = queries;
    }

    @Override
    public ConditionType type() {
        return ConditionType.TOTAL_WEIGH_INS;
    }

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        double target = condition.positiveTarget().orElse(DEFAULT_TARGET);
        if (!ctx.unlocked()) return TaskEvaluation.atLeast(0, target);

        long total = queries.countWeighInsSince(ctx.userId(), ctx.floorDate());
        return TaskEvaluation.atLeast(total, target);
    }
}
