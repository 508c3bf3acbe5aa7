package com.fitjourney.backend.journey.condition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * condition_json.operator：gte / lte / eq / between。
 * 目前內建的條件種類都不看 operator，只保存下來原樣回傳。
 */
public enum ComparisonOperator {
    GTE, LTE, EQ, BETWEEN;

    @JsonCreator
    public static ComparisonOperator fromJson(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return ComparisonOperator.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null; // 未知 operator 當作沒給
        }
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
