package com.fitjourney.backend.journey.target;

/**
 * 使用者目前計畫的每日目標快照。沒有計畫時整個物件不存在（Optional.empty）。
 * tdee 可能沒有，沒有時以 calories 代替。
 */
public record UserNutritionTargets(double calories, double proteinGrams, double tdee) {

    public double valueOf(TargetKind kind) {
        return switch (kind) {
            case PROTEIN -> proteinGrams;
            case CALORIES -> calories;
        };
    }
}
