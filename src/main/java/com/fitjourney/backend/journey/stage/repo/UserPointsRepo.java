package com.fitjourney.backend.journey.stage.repo;

import com.fitjourney.backend.journey.stage.entity.UserPointsEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserPointsRepo extends JpaRepository<UserPointsEntry, Long> {
}
