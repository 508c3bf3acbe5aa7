package com.fitjourney.backend.healthplan.dto;

public record SaveHealthPlanRequest(
        // meta
        String source,          // "ONBOARDING" / "SETTINGS"
        String calcVersion,     // "healthcalc_v1"

        // results（journey 任務的 live target）
        Integer kcal,
        Integer carbsG,
        Integer proteinG,
        Integer fatG,
        Integer tdee
) {}
