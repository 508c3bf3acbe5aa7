package com.fitjourney.backend.journey.service;

import com.fitjourney.backend.journey.cache.ProgressCacheInvalidator;
import com.fitjourney.backend.journey.dto.CompletionResponse;
import com.fitjourney.backend.journey.stage.entity.UserPointsEntry;
import com.fitjourney.backend.journey.stage.entity.UserStage;
import com.fitjourney.backend.journey.stage.entity.UserStageTask;
import com.fitjourney.backend.journey.stage.repo.UserPointsRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageRepo;
import com.fitjourney.backend.journey.stage.repo.UserStageTaskRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 條件已確認達成後的寫入（標記完成、加點數、完成關卡、解鎖下一關）。
 * 條件評估不可放進這個交易（查詢例外會把交易標成 rollback-only）。
 */
@Slf4j
@Service
public class TaskCompletionWriter {

    private final UserStageRepo stages;
    private final UserStageTaskRepo tasks;
    private final UserPointsRepo points;
    private final ProgressCacheInvalidator invalidator;
    private final Clock clock;

    public TaskCompletionWriter(
            UserStageRepo stages,
            UserStageTaskRepo tasks,
            UserPointsRepo points,
            ProgressCacheInvalidator invalidator,
            Clock clock
    ) {
        this.stages = stages;
        this.tasks = tasks;
        this.points = points;
        this.invalidator = invalidator;
        this.clock = clock;
    }

    @Transactional
    public CompletionResponse apply(Long userId, Long stageId, UserStageTask task, List<String> satisfied) {
        UserStage stage = stages.findByIdAndUserId(stageId, userId)
                .orElseThrow(() -> new IllegalArgumentException("TASK_NOT_FOUND"));

        Instant now = Instant.now(clock);
        if (tasks.markCompleted(task.getId(), now) == 0) {
            // 同時兩個 request：後到的當作已完成，不重複給點數
            return CompletionResponse.ofAlreadyCompleted();
        }

        int awarded = (task.getPoints() == null) ? 0 : task.getPoints();
        if (awarded > 0) {
            UserPointsEntry entry = new UserPointsEntry();
            entry.setUserId(userId);
            entry.setPoints(awarded);
            entry.setTaskId(task.getId());
            entry.setReason("TASK_COMPLETED:" + task.getKeyCode());
            points.save(entry);
        }

        boolean stageCompleted = false;
        boolean unlockedNext = false;
        if (tasks.countByUserStageIdAndCompletedFalse(stageId) == 0) {
            stageCompleted = true;
            stage.setCompleted(true);
            stage.setCompletedAt(now);
            stages.save(stage);

            UserStage next = stages.findByUserIdAndStageIndex(userId, stage.getStageIndex() + 1).orElse(null);
            if (next != null && !next.isUnlocked()) {
                next.setUnlocked(true);
                next.setUnlockedAt(now);
                stages.save(next);
                unlockedNext = true;
            }
        }

        invalidator.invalidateUserAfterCommit(userId);

        log.info("task completed. userId={} stageId={} taskId={} points={} stageCompleted={} unlockedNext={}",
                userId, stageId, task.getId(), awarded, stageCompleted, unlockedNext);
        return CompletionResponse.completed(satisfied, awarded, stageCompleted, unlockedNext);
    }
}
