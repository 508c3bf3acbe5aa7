package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import org.springframework.stereotype.Component;

@Component
public class LogMealsTodayEvaluator implements ConditionEvaluator {

    static final double DEFAULT_TARGET = 3;

    private final ActivityQueryClient queries;

    public LogMealsTodayEvaluator(ActivityQueryClient queries) {
        this.queries = queries;
    }

    @Override
    public ConditionType type() {
        return ConditionType.LOG_MEALS_TODAY;
    }

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        double target = condition.positiveTarget().orElse(DEFAULT_TARGET);
        long count = queries.countMealsOn(ctx.userId(), ctx.today());
        return TaskEvaluation.atLeast(count, target);
    }
}
