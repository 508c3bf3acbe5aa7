package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import org.springframework.stereotype.Component;

/** 階段解鎖後累計記錄的餐數 */
@Component
public class TotalMealsLoggedEvaluator implements ConditionEvaluator {

    static final double DEFAULT_TARGET = 50;

    private final ActivityQueryClient queries;

    public TotalMealsLoggedEvaluator(ActivityQueryClient queries) {
        this.queries = queries;
    }

    @Override
    public ConditionType type() {
        return ConditionType.TOTAL_MEALS_LOGGED;
    }

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        double target = condition.positiveTarget().orElse(DEFAULT_TARGET);
        if (!ctx.unlocked()) return TaskEvaluation.atLeast(0, target);

        long total = queries.countMealsSince(ctx.userId(), ctx.floorDate());
        return TaskEvaluation.atLeast(total, target);
    }
}
