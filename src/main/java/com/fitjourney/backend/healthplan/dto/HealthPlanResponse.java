package com.fitjourney.backend.healthplan.dto;

import java.time.Instant;

public record HealthPlanResponse(
        Long userId,
        String source,
        String calcVersion,
        Integer kcal,
        Integer carbsG,
        Integer proteinG,
        Integer fatG,
        Integer tdee,
        Instant updatedAt
) {}
