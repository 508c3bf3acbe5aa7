package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import com.fitjourney.backend.journey.target.TargetResolver;
import org.springframework.stereotype.Component;

@Component
public class WeeklyDeficitEvaluator extends WeeklyCalorieWindowEvaluator {

    static final double DEFAULT_BUFFER_KCAL = 100;

    public WeeklyDeficitEvaluator(ActivityQueryClient queries, TargetResolver targets) {
        super(queries, targets);
    }

    @Override
    public ConditionType type() {
        return ConditionType.WEEKLY_DEFICIT;
    }

    @Override
    protected double bufferFor(TaskCondition condition) {
        return DEFAULT_BUFFER_KCAL;
    }
}
