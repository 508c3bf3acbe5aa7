package com.fitjourney.backend.journey.service;

import com.fitjourney.backend.journey.cache.CacheKeys;
import com.fitjourney.backend.journey.cache.ProgressCache;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskConditionParser;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.dto.StageCompletionResponse;
import com.fitjourney.backend.journey.dto.TaskProgressResponse;
import com.fitjourney.backend.journey.evaluator.ConditionSetEvaluator;
import com.fitjourney.backend.journey.evaluator.EvaluationContext;
import com.fitjourney.backend.journey.stage.entity.UserStage;
import com.fitjourney.backend.journey.stage.entity.UserStageTask;
import com.fitjourney.backend.journey.stage.repo.UserStageRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageTaskRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 任務進度（只讀）。結果可以放快取；寫入路徑負責清快取。
 * 查詢失敗的結果不放快取，下一次請求會重算。
 */
@Slf4j
@Service
public class TaskProgressService {

    private final ConditionSetEvaluator sets;
    private final TaskConditionParser parser;
    private final UserStageRepo stages;
    private final UserStageTaskRepo tasks;
    private final ProgressCache cache;
    private final TaskExecutor executor;
    private final Clock clock;

    public TaskProgressService(
            ConditionSetEvaluator sets,
            TaskConditionParser parser,
            UserStageRepo stages,
            UserStageTaskRepo tasks,
            ProgressCache cache,
            @Qualifier("evaluationExecutor") TaskExecutor executor,
            Clock clock
    ) {
        this.sets = sets;
        this.parser = parser;
        this.stages = stages;
        this.tasks = tasks;
        this.cache = cache;
        this.executor = executor;
        this.clock = clock;
    }

    /** 一組條件合併後的結果（單一條件 = 一個元素的清單） */
    public TaskEvaluation evaluate(Long userId, List<TaskCondition> conditions, Instant stageUnlockedAt) {
        return sets.evaluateAll(conditions, context(userId, stageUnlockedAt));
    }

    /** 每個條件各自的結果，不經過快取 */
    public List<TaskEvaluation> evaluateEach(Long userId, List<TaskCondition> conditions, Instant stageUnlockedAt) {
        return sets.evaluateEach(conditions, context(userId, stageUnlockedAt));
    }

    public TaskProgressResponse evaluateTask(Long userId, Long stageId, Long taskId) {
        String key = CacheKeys.progress(userId, taskId);
        var cached = cache.get(key, TaskProgressResponse.class);
        if (cached.isPresent() && stageId.equals(cached.get().stageId())) return cached.get();

        UserStage stage = requireStage(userId, stageId, "TASK_NOT_FOUND");
        UserStageTask task = tasks.findByIdAndUserStageId(taskId, stageId)
                .orElseThrow(() -> new IllegalArgumentException("TASK_NOT_FOUND"));

        TaskProgressResponse res;
        if (task.isCompleted()) {
            res = new TaskProgressResponse(stageId, taskId, true, !stage.isUnlocked(), true, 1.0,
                    null, List.of(), Instant.now(clock));
        } else {
            List<TaskCondition> conditions = parser.parse(task.getConditionJson());
            List<TaskEvaluation> each = evaluateEach(userId, conditions, stage.getUnlockedAt());
            TaskEvaluation overall = ConditionSetEvaluator.combine(each);
            res = new TaskProgressResponse(stageId, taskId, false, !stage.isUnlocked(),
                    overall.canComplete(), overall.progress(), overall.details(), each, Instant.now(clock));

            if (!overall.isReliable()) return res;
        }

        cache.set(key, res);
        return res;
    }

    /**
     * 一個階段所有任務能不能完成。任務之間平行評估，
     * 同一任務的條件在該 worker 上依序評估。
     */
    public StageCompletionResponse completionMap(Long userId, Long stageId) {
        String key = CacheKeys.journey(userId, stageId);
        var cached = cache.get(key, StageCompletionResponse.class);
        if (cached.isPresent()) return cached.get();

        UserStage stage = requireStage(userId, stageId, "STAGE_NOT_FOUND");
        EvaluationContext ctx = context(userId, stage.getUnlockedAt());

        Map<Long, CompletableFuture<TaskEvaluation>> futures = new LinkedHashMap<>();
        for (UserStageTask t : tasks.findByUserStageIdOrderByOrderIndexAsc(stageId)) {
            if (t.isCompleted()) {
                futures.put(t.getId(), CompletableFuture.completedFuture(TaskEvaluation.vacuous()));
                continue;
            }
            List<TaskCondition> conditions = parser.parse(t.getConditionJson());
            futures.put(t.getId(), CompletableFuture.supplyAsync(() -> sets.evaluateSequentially(conditions, ctx), executor));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<Long, Boolean> out = new LinkedHashMap<>();
        boolean reliable = true;
        for (var e : futures.entrySet()) {
            TaskEvaluation r = e.getValue().join();
            out.put(e.getKey(), r.canComplete());
            reliable &= r.isReliable();
        }

        StageCompletionResponse res = new StageCompletionResponse(stageId, Collections.unmodifiableMap(out));
        log.debug("completion map evaluated. userId={} stageId={} tasks={} reliable={}", userId, stageId, out.size(), reliable);
        if (reliable) cache.set(key, res);
        return res;
    }

    EvaluationContext context(Long userId, Instant stageUnlockedAt) {
        return new EvaluationContext(userId, LocalDate.now(clock), stageUnlockedAt, clock.getZone());
    }

    private UserStage requireStage(Long userId, Long stageId, String notFoundCode) {
        // 不是自己的階段一律當作不存在
        return stages.findByIdAndUserId(stageId, userId)
                .orElseThrow(() -> new IllegalArgumentException(notFoundCode));
    }
}
