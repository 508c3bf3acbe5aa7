package com.fitjourney.backend.journey.query;

import com.fitjourney.backend.journey.target.UserNutritionTargets;
import com.fitjourney.backend.journey.window.DailyValue;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 評估引擎對資料層的唯一入口（只讀）。
 * 實作可以丟 RuntimeException（例如 DataAccessException），由 dispatcher 接住降級。
 */
public interface ActivityQueryClient {

    long countMealsOn(Long userId, LocalDate day);

    double sumProteinOn(Long userId, LocalDate day);

    /** 每一餐一筆 (date, calories)，date >= fromInclusive */
    List<DailyValue> mealCaloriesSince(Long userId, LocalDate fromInclusive);

    Set<LocalDate> mealDatesSince(Long userId, LocalDate fromInclusive);

    long countMealsSince(Long userId, LocalDate fromInclusive);

    long countWeighInsSince(Long userId, LocalDate fromInclusive);

    boolean hasAnyWeighIn(Long userId);

    /** 計畫不存在時回 empty */
    Optional<UserNutritionTargets> liveTargets(Long userId);
}
