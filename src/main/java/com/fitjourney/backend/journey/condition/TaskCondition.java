package com.fitjourney.backend.journey.condition;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * 掛在任務上的條件（user_stage_tasks.condition_json），建立後不可變。
 *
 * <p>{@code target} 的意義依 type 而定：次數、蛋白質克數、連續天數，
 * 或 WEEKLY_BALANCED 的容許誤差（kcal）。{@code type} 保留原字串，
 * 未知種類也能被解析出來，交給 dispatcher 決定怎麼處理。</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskCondition(
        String type,
        Double target,
        ComparisonOperator operator,
        List<Double> range,
        @JsonProperty("lookback_days") @JsonAlias("lookbackDays") Integer lookbackDays,
        @JsonProperty("use_user_target") @JsonAlias("useUserTarget") Boolean useUserTarget,
        @JsonProperty("buffer_kcal") @JsonAlias("bufferKcal") Double bufferKcal
) {

    public TaskCondition {
        range = (range == null) ? null : List.copyOf(range);
    }

    public static TaskCondition of(ConditionType type) {
        return new TaskCondition(type.name(), null, null, null, null, null, null);
    }

    public static TaskCondition of(ConditionType type, double target) {
        return new TaskCondition(type.name(), target, null, null, null, null, null);
    }

    public Optional<ConditionType> conditionType() {
        return ConditionType.fromCode(type);
    }

    public TaskCondition withLookbackDays(Integer days) {
        return new TaskCondition(type, target, operator, range, days, useUserTarget, bufferKcal);
    }

    public TaskCondition withUseUserTarget(Boolean flag) {
        return new TaskCondition(type, target, operator, range, lookbackDays, flag, bufferKcal);
    }

    public TaskCondition withBufferKcal(Double kcal) {
        return new TaskCondition(type, target, operator, range, lookbackDays, useUserTarget, kcal);
    }

    /** target 有給且 > 0 才算數（0 / 負數視同沒設定） */
    public Optional<Double> positiveTarget() {
        return (target != null && target > 0 && !target.isNaN()) ? Optional.of(target) : Optional.empty();
    }

    /** lookback_days <= 0 視同沒設定，由呼叫端套預設值 */
    public int lookbackDaysOr(int dft) {
        return (lookbackDays == null || lookbackDays <= 0) ? dft : lookbackDays;
    }

    public boolean prefersUserTarget() {
        return Boolean.TRUE.equals(useUserTarget);
    }
}
