package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import org.springframework.stereotype.Component;

/** 曾經量過一次體重就算（不看解鎖時間） */
@Component
public class FirstWeighInEvaluator implements ConditionEvaluator {

    private final ActivityQueryClient queries;

    public FirstWeighInEvaluator(ActivityQueryClient queries) {
        this.queries = queries;
    }

    @Override
    public ConditionType type() {
        return ConditionType.FIRST_WEIGH_IN;
    }

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        boolean has = queries.hasAnyWeighIn(ctx.userId());
        return TaskEvaluation.atLeast(has ? 1 : 0, 1);
    }
}
