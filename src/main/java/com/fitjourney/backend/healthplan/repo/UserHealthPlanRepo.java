package com.fitjourney.backend.healthplan.repo;

import com.fitjourney.backend.healthplan.entity.UserHealthPlan;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserHealthPlanRepo extends JpaRepository<UserHealthPlan, Long> {}
