package com.fitjourney.backend.journey.dto;

import com.fitjourney.backend.journey.condition.TaskEvaluation;

import java.util.List;

/** result = 合併後的結果；conditions = 每個條件各自的結果（順序同 request） */
public record EvaluateResponse(
        TaskEvaluation result,
        List<TaskEvaluation> conditions
) {}
