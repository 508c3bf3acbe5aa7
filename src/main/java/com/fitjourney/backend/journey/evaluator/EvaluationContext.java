package com.fitjourney.backend.journey.evaluator;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 一次評估共用的輸入：使用者、今天（依 Clock 時區算好）、階段解鎖時間。
 * stageUnlockedAt 為 null 代表階段還沒開始。
 */
public record EvaluationContext(Long userId, LocalDate today, Instant stageUnlockedAt, ZoneId zone) {

    /** 解鎖當天（含）之後的紀錄才算；沒解鎖回 null */
    public LocalDate floorDate() {
        return (stageUnlockedAt == null) ? null : LocalDate.ofInstant(stageUnlockedAt, zone);
    }

    public boolean unlocked() {
        return stageUnlockedAt != null;
    }
}
