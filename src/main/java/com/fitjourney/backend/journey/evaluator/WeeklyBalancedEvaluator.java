package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import com.fitjourney.backend.journey.target.TargetResolver;
import org.springframework.stereotype.Component;

/** 平衡週：condition.target 是容許誤差（kcal），不是每日熱量 */
@Component
public class WeeklyBalancedEvaluator extends WeeklyCalorieWindowEvaluator {

    static final double DEFAULT_BUFFER_KCAL = 200;

    public WeeklyBalancedEvaluator(ActivityQueryClient queries, TargetResolver targets) {
        super(queries, targets);
    }

    @Override
    public ConditionType type() {
        return ConditionType.WEEKLY_BALANCED;
    }

    @Override
    protected double bufferFor(TaskCondition condition) {
        return condition.positiveTarget().orElse(DEFAULT_BUFFER_KCAL);
    }
}
