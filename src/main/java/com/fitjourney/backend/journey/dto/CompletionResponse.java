package com.fitjourney.backend.journey.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompletionResponse(
        boolean ok,
        boolean canComplete,
        boolean alreadyCompleted,
        List<String> satisfied,
        List<String> missing,
        double progress,
        int pointsAwarded,
        boolean stageCompleted,
        boolean unlockedNext,
        String error
) {

    public static final String CONDITIONS_NOT_MET = "CONDITIONS_NOT_MET";
    public static final String EVALUATION_FAILED = "EVALUATION_FAILED";

    public static CompletionResponse ofAlreadyCompleted() {
        return new CompletionResponse(true, true, true, List.of(), List.of(), 1.0, 0, false, false, null);
    }

    public static CompletionResponse completed(List<String> satisfied, int points, boolean stageCompleted, boolean unlockedNext) {
        return new CompletionResponse(true, true, false, satisfied, List.of(), 1.0, points, stageCompleted, unlockedNext, null);
    }

    public static CompletionResponse rejected(String error, List<String> satisfied, List<String> missing, double progress) {
        return new CompletionResponse(false, false, false, satisfied, missing, progress, 0, false, false, error);
    }
}
