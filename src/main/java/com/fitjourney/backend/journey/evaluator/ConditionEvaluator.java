package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;

/**
 * 一種條件一個實作（Spring bean），由 {@link ConditionEvaluatorRegistry} 依 type 分派。
 * 查詢失敗直接往外丟，registry 會接住並回安全預設值。
 */
public interface ConditionEvaluator {

    ConditionType type();

    TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx);
}
