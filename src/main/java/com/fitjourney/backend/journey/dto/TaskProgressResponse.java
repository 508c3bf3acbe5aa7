package com.fitjourney.backend.journey.dto;

import com.fitjourney.backend.journey.condition.TaskEvaluation;

import java.time.Instant;
import java.util.List;

public record TaskProgressResponse(
        Long stageId,
        Long taskId,
        boolean completed,
        boolean stageLocked,
        boolean canComplete,
        double progress,
        String details,
        List<TaskEvaluation> conditions,
        Instant evaluatedAt
) {}
