package com.fitjourney.backend.journey.condition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fitjourney.backend.journey.target.TargetSource;

/**
 * 單一條件（或一組條件）的評估結果。
 *
 * <ul>
 *   <li>{@code progress} 一律夾在 [0,1]，NaN 當 0。</li>
 *   <li>{@code canComplete} 是各條件自己的判斷，不等於 progress == 1
 *       （例如每週條件要求「每一天」都在範圍內）。</li>
 *   <li>{@code targetSource} 說明 target 從哪一層來（live plan / 任務凍結值 / 預設）。</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskEvaluation(
        boolean canComplete,
        double progress,
        Double current,
        Double target,
        String details,
        TargetSource targetSource,
        EvaluationStatus status
) {

    public TaskEvaluation {
        progress = clamp01(progress);
        if (status == null) status = EvaluationStatus.OK;
    }

    /** 空條件集合：視為已滿足 */
    public static TaskEvaluation vacuous() {
        return new TaskEvaluation(true, 1.0, null, null, null, null, EvaluationStatus.OK);
    }

    public static TaskEvaluation unknownType() {
        return new TaskEvaluation(false, 0.0, null, null, null, null, EvaluationStatus.UNKNOWN_TYPE);
    }

    public static TaskEvaluation queryFailed() {
        return new TaskEvaluation(false, 0.0, null, null, null, null, EvaluationStatus.QUERY_FAILED);
    }

    /**
     * 累計型：current >= target 即可完成，progress = min(current/target, 1)。
     * target <= 0 不應該出現（呼叫端已套預設值），保險起見視為 0 進度。
     */
    public static TaskEvaluation atLeast(double current, double target) {
        return atLeast(current, target, null);
    }

    public static TaskEvaluation atLeast(double current, double target, TargetSource source) {
        double progress = (target > 0) ? Math.min(current / target, 1.0) : 0.0;
        return new TaskEvaluation(target > 0 && current >= target, progress, current, target, null, source, EvaluationStatus.OK);
    }

    public TaskEvaluation withDetails(String newDetails) {
        return new TaskEvaluation(canComplete, progress, current, target, newDetails, targetSource, status);
    }

    public TaskEvaluation withCurrent(Double newCurrent) {
        return new TaskEvaluation(canComplete, progress, newCurrent, target, details, targetSource, status);
    }

    @JsonIgnore
    public boolean isReliable() {
        return status != EvaluationStatus.QUERY_FAILED;
    }

    static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.min(1.0, Math.max(0.0, v));
    }
}
