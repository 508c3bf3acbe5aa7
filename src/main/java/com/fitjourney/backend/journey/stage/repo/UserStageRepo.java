package com.fitjourney.backend.journey.stage.repo;

import com.fitjourney.backend.journey.stage.entity.UserStage;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserStageRepo extends JpaRepository<UserStage, Long> {

    Optional<UserStage> findByIdAndUserId(Long id, Long userId);

    Optional<UserStage> findByUserIdAndStageIndex(Long userId, Integer stageIndex);
}
