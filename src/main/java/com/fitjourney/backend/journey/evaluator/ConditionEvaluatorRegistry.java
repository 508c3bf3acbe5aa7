package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.ConditionType;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 依 condition.type 分派到對應的 {@link ConditionEvaluator}。
 *
 * <ul>
 *   <li>未知種類：warn + 0 進度（不丟例外）</li>
 *   <li>查詢失敗：warn + 0 進度，status = QUERY_FAILED</li>
 * </ul>
 */
@Slf4j
@Service
public class ConditionEvaluatorRegistry {

    private final Map<ConditionType, ConditionEvaluator> byType;

    public ConditionEvaluatorRegistry(List<ConditionEvaluator> evaluators) {
        Map<ConditionType, ConditionEvaluator> m = new EnumMap<>(ConditionType.class);
        for (ConditionEvaluator e : evaluators) {
            ConditionEvaluator prev = m.putIfAbsent(e.type(), e);
            if (prev != null) {
                throw new IllegalStateException(
                        "DUPLICATE_CONDITION_EVALUATOR: " + e.type()
                        + ", prev=" + prev.getClass().getName()
                        + ", dup=" + e.getClass().getName()
                );
            }
        }
        this.byType = Collections.unmodifiableMap(m);

        log.info("ConditionEvaluatorRegistry initialized. available={}", this.byType.keySet());
    }

    public TaskEvaluation evaluate(TaskCondition condition, EvaluationContext ctx) {
        Optional<ConditionType> type = (condition == null) ? Optional.empty() : condition.conditionType();
        ConditionEvaluator evaluator = type.map(byType::get).orElse(null);
        if (evaluator == null) {
            log.warn("unknown condition type. userId={} type={}", ctx.userId(), condition == null ? null : condition.type());
            return TaskEvaluation.unknownType();
        }

        try {
            return evaluator.evaluate(condition, ctx);
        } catch (RuntimeException ex) {
            log.warn("condition evaluation failed. userId={} type={} err={}",
                    ctx.userId(), evaluator.type(), ex.toString(), ex);
            return TaskEvaluation.queryFailed();
        }
    }
}
