package com.fitjourney.backend.journey.dto;

import java.util.Map;

/** taskId → 現在能不能完成（已完成的任務固定 true） */
public record StageCompletionResponse(
        Long stageId,
        Map<Long, Boolean> tasks
) {}
