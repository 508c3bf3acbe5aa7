package com.fitjourney.backend.meal.service;

import com.fitjourney.backend.journey.cache.ProgressCacheInvalidator;
import com.fitjourney.backend.meal.dto.LogMealRequest;
import com.fitjourney.backend.meal.dto.MealItemDto;
import com.fitjourney.backend.meal.entity.MealEntry;
import com.fitjourney.backend.meal.repo.MealEntryRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
public class MealService {

    private final MealEntryRepo meals;
    private final ProgressCacheInvalidator invalidator;
    private final Clock clock;

    public MealService(MealEntryRepo meals, ProgressCacheInvalidator invalidator, Clock clock) {
        this.meals = meals;
        this.invalidator = invalidator;
        this.clock = clock;
    }

    @Transactional
    public MealItemDto log(Long uid, LogMealRequest req) {
        LocalDate today = LocalDate.now(clock);
        LocalDate date = (req.mealDate() != null) ? req.mealDate() : today;
        if (date.isAfter(today)) throw new IllegalArgumentException("MEAL_DATE_IN_FUTURE");

        MealEntry m = new MealEntry();
        m.setUserId(uid);
        m.setMealDate(date);
        m.setName(req.name());
        m.setCalories(nz(req.calories()));
        m.setProteinG(nz(req.proteinG()));
        m.setCarbsG(req.carbsG());
        m.setFatG(req.fatG());
        meals.save(m);

        // 新的一餐會改變 journey 條件的輸入
        invalidator.invalidateUserAfterCommit(uid);

        log.info("meal logged. userId={} mealDate={} kcal={} proteinG={}", uid, date, m.getCalories(), m.getProteinG());
        return toItem(m);
    }

    @Transactional(readOnly = true)
    public List<MealItemDto> listByDate(Long uid, LocalDate date) {
        LocalDate d = (date != null) ? date : LocalDate.now(clock);
        return meals.findByUserIdAndMealDateOrderByCreatedAtAsc(uid, d).stream()
                .map(MealService::toItem)
                .toList();
    }

    static MealItemDto toItem(MealEntry m) {
        return new MealItemDto(
                m.getId(),
                m.getMealDate(),
                m.getName(),
                nz(m.getCalories()),
                nz(m.getProteinG()),
                m.getCarbsG(),
                m.getFatG(),
                m.getCreatedAt()
        );
    }

    private static double nz(Double v) {
        return (v == null || v.isNaN()) ? 0.0 : v;
    }
}
