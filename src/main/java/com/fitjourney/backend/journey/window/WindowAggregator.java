package com.fitjourney.backend.journey.window;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 把紀錄依日曆日分桶、加總成每日總量。
 *
 * <ul>
 *   <li>date &lt; today - lookbackDays 的紀錄排除</li>
 *   <li>date &gt; today 的紀錄排除（視窗到今天為止）</li>
 *   <li>同一天多筆相加；沒紀錄的日子不會出現在結果裡（下游當 0）</li>
 * </ul>
 * 結果是依日期排序的 map，同一批紀錄 + 同一個 today，不管輸入順序都得到相同結果。
 */
public final class WindowAggregator {

    private WindowAggregator() {}

    public static SortedMap<LocalDate, Double> aggregate(Collection<DailyValue> records, int lookbackDays, LocalDate today) {
        if (records == null || records.isEmpty() || today == null) return Collections.emptySortedMap();

        LocalDate cutoff = windowStart(today, lookbackDays);
        TreeMap<LocalDate, Double> totals = new TreeMap<>();
        for (DailyValue r : records) {
            if (r == null || r.date() == null) continue;
            if (r.date().isBefore(cutoff) || r.date().isAfter(today)) continue;
            totals.merge(r.date(), r.value(), Double::sum);
        }
        return Collections.unmodifiableSortedMap(totals);
    }

    /** 視窗最早的一天（含）：today - lookbackDays；負數當 0 */
    public static LocalDate windowStart(LocalDate today, int lookbackDays) {
        return today.minusDays(Math.max(0, lookbackDays));
    }
}
