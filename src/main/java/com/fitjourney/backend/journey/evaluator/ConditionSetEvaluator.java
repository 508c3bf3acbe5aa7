package com.fitjourney.backend.journey.evaluator;

import com.fitjourney.backend.journey.condition.EvaluationStatus;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 一個任務的多個條件一律 AND：
 * <ul>
 *   <li>空集合 → 可完成、progress 1</li>
 *   <li>canComplete = 每個條件都可完成</li>
 *   <li>progress = 各條件 progress 的平均</li>
 *   <li>details = 非空的 details 用 ", " 串起來</li>
 * </ul>
 */
@Service
public class ConditionSetEvaluator {

    private final ConditionEvaluatorRegistry registry;
    private final TaskExecutor executor;

    public ConditionSetEvaluator(ConditionEvaluatorRegistry registry,
                                 @Qualifier("evaluationExecutor") TaskExecutor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    /** 各條件平行評估後合併 */
    public TaskEvaluation evaluateAll(List<TaskCondition> conditions, EvaluationContext ctx) {
        return combine(evaluateEach(conditions, ctx));
    }

    /**
     * 同一條執行緒依序評估。批次（多個任務已經平行）時用這個，
     * 避免在同一個 pool 裡再 fan-out 互相等待。
     */
    public TaskEvaluation evaluateSequentially(List<TaskCondition> conditions, EvaluationContext ctx) {
        if (conditions == null || conditions.isEmpty()) return TaskEvaluation.vacuous();
        List<TaskEvaluation> results = new ArrayList<>(conditions.size());
        for (TaskCondition c : conditions) {
            results.add(registry.evaluate(c, ctx));
        }
        return combine(results);
    }

    /** 每個條件各自的結果，順序跟輸入一致 */
    public List<TaskEvaluation> evaluateEach(List<TaskCondition> conditions, EvaluationContext ctx) {
        if (conditions == null || conditions.isEmpty()) return List.of();
        if (conditions.size() == 1) return List.of(registry.evaluate(conditions.get(0), ctx));

        List<CompletableFuture<TaskEvaluation>> futures = conditions.stream()
                .map(c -> CompletableFuture.supplyAsync(() -> registry.evaluate(c, ctx), executor))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public static TaskEvaluation combine(List<TaskEvaluation> results) {
        if (results == null || results.isEmpty()) return TaskEvaluation.vacuous();

        boolean all = true;
        double sum = 0;
        EvaluationStatus status = EvaluationStatus.OK;
        for (TaskEvaluation r : results) {
            all &= r.canComplete();
            sum += r.progress();
            status = status.worse(r.status());
        }

        String details = results.stream()
                .map(TaskEvaluation::details)
                .filter(d -> d != null && !d.isBlank())
                .collect(Collectors.joining(", "));

        return new TaskEvaluation(all, sum / results.size(), null, null, details, null, status);
    }
}
