package com.fitjourney.backend.journey.target;

/**
 * live plan 的 target 什麼時候可以蓋過任務上凍結的值。
 */
public enum PersonalizationPolicy {
    /** 永遠優先用 live plan：使用者改計畫，所有未完成任務跟著變 */
    ALWAYS,
    /** 只有 condition_json.use_user_target = true 的任務才用 live plan */
    FLAG_GATED
}
