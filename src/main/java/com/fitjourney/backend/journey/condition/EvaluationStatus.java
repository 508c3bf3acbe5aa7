package com.fitjourney.backend.journey.condition;

/**
 * 評估結果是否「可信」。進度數字本身不帶這個資訊：
 * 查詢失敗跟條件未達成，畫面上看起來一樣（0 進度、不可完成），
 * 只有完成 API 需要分辨兩者。
 */
public enum EvaluationStatus {
    OK,
    UNKNOWN_TYPE,
    QUERY_FAILED;

    /** 合併多個條件時取最嚴重的 */
    public EvaluationStatus worse(EvaluationStatus other) {
        if (other == null) return this;
        return (other.ordinal() > this.ordinal()) ? other : this;
    }
}
