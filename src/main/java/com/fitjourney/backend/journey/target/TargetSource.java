package com.fitjourney.backend.journey.target;

/**
 * target 實際取自哪一層（依優先順序）。
 */
public enum TargetSource {
    /** 使用者目前的營養計畫（user_health_plan） */
    LIVE_PLAN,
    /** 任務建立時凍結在 condition_json.target 的值 */
    FROZEN_CONDITION,
    /** 寫死的預設值 */
    DEFAULT
}
