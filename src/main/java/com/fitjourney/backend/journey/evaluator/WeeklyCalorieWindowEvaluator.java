package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.query.ActivityQueryClient;
import com.fitjourney.backend.journey.target.ResolvedTarget;
import com.fitjourney.backend.journey.target.TargetKind;
import com.fitjourney.backend.journey.target.TargetResolver;
import com.fitjourney.backend.journey.window.DailyValue;
import com.fitjourney.backend.journey.window.WindowAggregator;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 每週熱量類條件的共用流程：
 * <ol>
 *   <li>視窗 = 最近 lookback 天（含今天），預設 7</li>
 *   <li>每日熱量總和落在 [target - buffer, target + buffer] 算一個 success day</li>
 *   <li>progress = successDays / lookback；全部天數都達標才可完成</li>
 * </ol>
 * 沒紀錄的日子總和是 0，不會落在範圍內。子類只決定 buffer 的預設值。
 */
@Slf4j
public abstract class WeeklyCalorieWindowEvaluator implements ConditionEvaluator {

    static final int DEFAULT_LOOKBACK_DAYS = 7;

    private final ActivityQueryClient queries;
    private final TargetResolver targets;

    protected WeeklyCalorieWindowEvaluator(ActivityQueryClient queries, TargetResolver targets) {
        this.queries = queries;
        this.targets = targets;
    }

    /** 沒給 buffer_kcal 時的容許誤差 */
    protected abstract double bufferFor(TaskCondition condition);

    @Override
    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        int lookback = condition.lookbackDaysOr(DEFAULT_LOOKBACK_DAYS);
        double buffer = (condition.bufferKcal() != null && condition.bufferKcal() > 0)
                ? condition.bufferKcal()
                : bufferFor(condition);

        ResolvedTarget daily = targets.resolve(TargetKind.CALORIES, condition, queries.liveTargets(ctx.userId()));

        LocalDate from = WindowAggregator.windowStart(ctx.today(), lookback - 1);
        List<DailyValue> meals = queries.mealCaloriesSince(ctx.userId(), from);
        Map<LocalDate, Double> totals = WindowAggregator.aggregate(meals, lookback - 1, ctx.today());

        double lower = daily.value() - buffer;
        double upper = daily.value() + buffer;
        int successDays = 0;
        for (double kcal : totals.values()) {
            if (kcal >= lower && kcal <= upper) successDays++;
        }

        log.debug("weekly window evaluated. type={} userId={} dailyTarget={} source={} buffer={} successDays={}/{}",
                type(), ctx.userId(), daily.value(), daily.source(), buffer, successDays, lookback);

        return new TaskEvaluation(
                successDays == lookback,
                (double) successDays / lookback,
                (double) successDays,
                (double) lookback,
                successDays + " of " + lookback + " days in range",
                daily.source(),
                null
        );
    }
}
