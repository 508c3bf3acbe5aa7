package com.fitjourney.backend.journey.stage.repo;

import com.fitjourney.backend.journey.stage.entity.UserStageTask;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface UserStageTaskRepo extends JpaRepository<UserStageTask, Long> {

    Optional<UserStageTask> findByIdAndUserStageId(Long id, Long userStageId);

    List<UserStageTask> findByUserStageIdOrderByOrderIndexAsc(Long userStageId);

    long countByUserStageIdAndCompletedFalse(Long userStageId);

    /**
     * 只有還沒完成的任務會被更新；回 0 代表別的 request 已經先完成（不可重複給點數）
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           update UserStageTask t
              set t.completed = true,
                  t.completedAt = :now,
                  t.updatedAt = :now
            where t.id = :id
              and t.completed = false
           """)
    int markCompleted(@Param("id") Long id, @Param("now") Instant now);
}
