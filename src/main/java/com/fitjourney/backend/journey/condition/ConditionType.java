package com.fitjourney.backend.journey.condition;

import java.util.Locale;
import java.util.Optional;

/**
 * 任務條件的種類（condition_json.type）。
 * 新增種類 = 這裡加一個值 + 一個 ConditionEvaluator bean，不用改 dispatcher。
 */
public enum ConditionType {
    FIRST_WEIGH_IN,
    LOG_MEALS_TODAY,
    HIT_PROTEIN_GOAL,
    STREAK_DAYS,
    WEEKLY_DEFICIT,
    WEEKLY_SURPLUS,
    WEEKLY_BALANCED,
    TOTAL_MEALS_LOGGED,
    TOTAL_WEIGH_INS;

    /** 不認得的字串回 empty（不丟例外，讓上層記 warn 後回 0 進度） */
    public static Optional<ConditionType> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        try {
            return Optional.of(ConditionType.valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
