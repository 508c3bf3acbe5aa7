package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import com.fitjourney.backend.journey.window.StreakCalculator;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Set;

/** 從今天往回、階段解鎖後「每天至少一餐」的連續天數 */
@Component
public class StreakDaysEvaluator implements ConditionEvaluator {

    static final double DEFAULT_TARGET = 7;

    private final ActivityQueryClient queries;

    public StreakDaysEvaluator(ActivityQueryClient queries) {
        this.queries = queries;
    }

    @Override
    public ConditionType type() {
        return ConditionType.STREAK_DAYS;
    }

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        double target = condition.positiveTarget().orElse(DEFAULT_TARGET);
        if (!ctx.unlocked()) return TaskEvaluation.atLeast(0, target);

        int required = (int) Math.ceil(target);
        LocalDate floor = ctx.floorDate();
        // 只需要最近 required 天的資料
        LocalDate from = ctx.today().minusDays(required - 1L);
        if (floor != null && floor.isAfter(from)) from = floor;

        Set<LocalDate> dates = queries.mealDatesSince(ctx.userId(), from);
        int streak = StreakCalculator.consecutiveDays(dates, required, floor, ctx.today());
        return TaskEvaluation.atLeast(streak, target);
    }
}
