package com.fitjourney.backend.journey.window;

import java.time.LocalDate;
import java.util.Set;

/**
 * 從今天往回數「連續有紀錄」的天數。
 *
 * <ul>
 *   <li>今天沒紀錄 → 0（連續紀錄必須包含今天才算進行中）</li>
 *   <li>遇到第一個缺的日子就停</li>
 *   <li>floorDate 之前的日子一律不算（階段解鎖前的歷史）</li>
 *   <li>最多走 requiredDays 步，回傳值不會超過 requiredDays</li>
 * </ul>
 */
public final class StreakCalculator {

    private StreakCalculator() {}

    public static int consecutiveDays(Set<LocalDate> recordDates, int requiredDays, LocalDate floorDate, LocalDate today) {
        if (recordDates == null || recordDates.isEmpty() || requiredDays <= 0 || today == null) return 0;

        int streak = 0;
        LocalDate check = today;
        while (streak < requiredDays) {
            if (floorDate != null && check.isBefore(floorDate)) break;
            if (!recordDates.contains(check)) break;
            streak++;
            check = check.minusDays(1);
        }
        return streak;
    }
}
