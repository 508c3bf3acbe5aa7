package com.fitjourney.backend.journey.query;

import com.fitjourney.backend.healthplan.entity.UserHealthPlan;
import com.fitjourney.backend.healthplan.repo.UserHealthPlanRepo;
import com.fitjourney.backend.journey.target.UserNutritionTargets;
import com.fitjourney.backend.journey.window.DailyValue;
import com.fitjourney.backend.meal.repo.MealEntryRepo;
import com.fitjourney.backend.weight.repo.WeighInRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class JpaActivityQueryClientTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    private MealEntryRepo meals;
    private UserHealthPlanRepo plans;
    private JpaActivityQueryClient client;

    @BeforeEach
    void setUp() {
        meals = mock(MealEntryRepo.class);
        plans = mock(UserHealthPlanRepo.class);
        client = new JpaActivityQueryClient(meals, mock(WeighInRepo.class), plans);
    }

    private static UserHealthPlan plan(Integer kcal, Integer protein, Integer tdee) {
        UserHealthPlan p = new UserHealthPlan();
        p.setUserId(1L);
        p.setKcal(kcal);
        p.setProteinG(protein);
        p.setTdee(tdee);
        return p;
    }

    @Test
    void live_targets_fall_back_to_kcal_when_tdee_missing() {
        when(plans.findById(1L)).thenReturn(Optional.of(plan(2100, 140, null)));

        assertThat(client.liveTargets(1L)).contains(new UserNutritionTargets(2100, 140, 2100));
    }

    @Test
    void live_targets_absent_without_plan_or_with_empty_values() {
        when(plans.findById(1L)).thenReturn(Optional.empty());
        assertThat(client.liveTargets(1L)).isEmpty();

        when(plans.findById(1L)).thenReturn(Optional.of(plan(0, 0, null)));
        assertThat(client.liveTargets(1L)).isEmpty();
    }

    @Test
    void protein_sum_null_means_zero() {
        when(meals.sumProteinOn(1L, DAY)).thenReturn(null);
        assertThat(client.sumProteinOn(1L, DAY)).isZero();
    }

    @Test
    void meal_calories_are_projected_to_daily_values() {
        MealEntryRepo.DayCalories row = mock(MealEntryRepo.DayCalories.class);
        when(row.getMealDate()).thenReturn(DAY);
        when(row.getCalories()).thenReturn(null);
        when(meals.findCaloriesSince(1L, DAY)).thenReturn(List.of(row));

        assertThat(client.mealCaloriesSince(1L, DAY)).containsExactly(new DailyValue(DAY, 0.0));
    }
}
