package com.fitjourney.backend.journey.query;

import com.fitjourney.backend.healthplan.entity.UserHealthPlan;
import com.fitjourney.backend.healthplan.repo.UserHealthPlanRepo;
import com.fitjourney.backend.journey.target.UserNutritionTargets;
import com.fitjourney.backend.journey.window.DailyValue;
import com.fitjourney.backend.meal.repo.MealEntryRepo;
import com.fitjourney.backend.weight.repo.WeighInRepo;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@Transactional(readOnly = true)
public class JpaActivityQueryClient implements ActivityQueryClient {

    private final MealEntryRepo meals;
    private final WeighInRepo weighIns;
    private final UserHealthPlanRepo plans;

    public JpaActivityQueryClient(MealEntryRepo meals, WeighInRepo weighIns, UserHealthPlanRepo plans) {
        this.meals = meals;
        this.weighIns = weighIns;
        this.plans = plans;
    }

    @Override
    public long countMealsOn(Long userId, LocalDate day) {
        return meals.countByUserIdAndMealDate(userId, day);
    }

    @Override
    public double sumProteinOn(Long userId, LocalDate day) {
        Double total = meals.sumProteinOn(userId, day);
        return (total == null) ? 0.0 : total;
    }

    @Override
    public List<DailyValue> mealCaloriesSince(Long userId, LocalDate fromInclusive) {
        return meals.findCaloriesSince(userId, fromInclusive).stream()
                .map(r -> new DailyValue(r.getMealDate(), r.getCalories() == null ? 0.0 : r.getCalories()))
                .toList();
    }

    @Override
    public Set<LocalDate> mealDatesSince(Long userId, LocalDate fromInclusive) {
        return new HashSet<>(meals.findDistinctDatesSince(userId, fromInclusive));
    }

    @Override
    public long countMealsSince(Long userId, LocalDate fromInclusive) {
        return meals.countByUserIdAndMealDateGreaterThanEqual(userId, fromInclusive);
    }

    @Override
    public long countWeighInsSince(Long userId, LocalDate fromInclusive) {
        return weighIns.countByUserIdAndLogDateGreaterThanEqual(userId, fromInclusive);
    }

    @Override
    public boolean hasAnyWeighIn(Long userId) {
        return weighIns.existsByUserId(userId);
    }

    @Override
    public Optional<UserNutritionTargets> liveTargets(Long userId) {
        return plans.findById(userId)
                .map(JpaActivityQueryClient::toTargets)
                .filter(t -> t.calories() > 0 || t.proteinGrams() > 0);
    }

    static UserNutritionTargets toTargets(UserHealthPlan p) {
        double kcal = (p.getKcal() == null) ? 0 : p.getKcal();
        double protein = (p.getProteinG() == null) ? 0 : p.getProteinG();
        // tdee 沒算過就用 kcal 代替
        double tdee = (p.getTdee() == null || p.getTdee() <= 0) ? kcal : p.getTdee();
        return new UserNutritionTargets(kcal, protein, tdee);
    }
}
