package com.fitjourney.backend.journey.service;

import com.fitjourney.backend.journey.condition.EvaluationStatus;
import com.fitjourney.backend.journey.condition.TaskCondition;
import com.fitjourney.backend.journey.condition.TaskConditionParser;
import com.fitjourney.backend.journey.condition.TaskEvaluation;
import com.fitjourney.backend.journey.dto.CompletionResponse;
import com.fitjourney.backend.journey.evaluator.ConditionSetEvaluator;
import com.fitjourney.backend.journey.stage.entity.UserStage;
import com.fitjourney.backend.journey.stage.entity.UserStageTask;
import com.fitjourney.backend.journey.stage.repo.UserStageRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageTaskRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 完成任務（唯一會寫入 journey 狀態的入口）。
 *
 * <p>一律用最新資料重新評估（不看快取）。條件沒達成回 CONDITIONS_NOT_MET；
 * 查詢失敗回 EVALUATION_FAILED，讓 client 知道要重試而不是去記餐。
 * 評估在交易外進行，通過後才交給 {@link TaskCompletionWriter} 開寫入交易。</p>
 */
@Slf4j
@Service
public class TaskCompletionService {

    private final UserStageRepo stages;
    private final UserStageTaskRepo tasks;
    private final TaskConditionParser parser;
    private final TaskProgressService progress;
    private final TaskCompletionWriter writer;

    public TaskCompletionService(
            UserStageRepo stages,
            UserStageTaskRepo tasks,
            TaskConditionParser parser,
            TaskProgressService progress,
            TaskCompletionWriter writer
    ) {
        this.stages = stages;
        this.tasks = tasks;
        this.parser = parser;
        this.progress = progress;
        this.writer = writer;
    }

    public CompletionResponse complete(Long userId, Long stageId, Long taskId) {
        UserStage stage = stages.findByIdAndUserId(stageId, userId)
                .orElseThrow(() -> new IllegalArgumentException("TASK_NOT_FOUND"));
        UserStageTask task = tasks.findByIdAndUserStageId(taskId, stageId)
                .orElseThrow(() -> new IllegalArgumentException("TASK_NOT_FOUND"));

        if (!stage.isUnlocked()) throw new IllegalStateException("STAGE_LOCKED");
        if (task.isCompleted()) return CompletionResponse.ofAlreadyCompleted();

        List<TaskCondition> conditions = parser.parse(task.getConditionJson());
        List<TaskEvaluation> each = progress.evaluateEach(userId, conditions, stage.getUnlockedAt());
        TaskEvaluation overall = ConditionSetEvaluator.combine(each);

        List<String> satisfied = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < each.size(); i++) {
            String type = conditions.get(i).type();
            (each.get(i).canComplete() ? satisfied : missing).add(type);
        }

        if (overall.status() == EvaluationStatus.QUERY_FAILED) {
            log.warn("task completion evaluation failed. userId={} stageId={} taskId={}", userId, stageId, taskId);
            return CompletionResponse.rejected(CompletionResponse.EVALUATION_FAILED, satisfied, missing, overall.progress());
        }
        if (!overall.canComplete()) {
            log.info("task conditions not met. userId={} taskId={} progress={} missing={}",
                    userId, taskId, overall.progress(), missing);
            return CompletionResponse.rejected(CompletionResponse.CONDITIONS_NOT_MET, satisfied, missing, overall.progress());
        }

        return writer.apply(userId, stageId, task, satisfied);
    }
}
