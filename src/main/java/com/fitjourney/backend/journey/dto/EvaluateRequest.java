package com.fitjourney.backend.journey.dto;

import com.fitjourney.backend.journey.condition.TaskCondition;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

/** 臨時評估一組條件（不綁任務），stageUnlockedAt 可省略 */
public record EvaluateRequest(
        @NotNull(message = "CONDITIONS_REQUIRED")
        @Size(max = 20, message = "TOO_MANY_CONDITIONS")
        List<TaskCondition> conditions,
        Instant stageUnlockedAt
) {}
