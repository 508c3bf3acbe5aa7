package com.fitjourney.backend.meal.repo;

import com.fitjourney.backend.meal.entity.MealEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface MealEntryRepo extends JpaRepository<MealEntry, Long> {

    long countByUserIdAndMealDate(Long userId, LocalDate mealDate);

    long countByUserIdAndMealDateGreaterThanEqual(Long userId, LocalDate from);

    List<MealEntry> findByUserIdAndMealDateOrderByCreatedAtAsc(Long userId, LocalDate mealDate);

    @Query("""
           select coalesce(sum(m.proteinG), 0.0) from MealEntry m
           where m.userId = :uid and m.mealDate = :day
           """)
    Double sumProteinOn(@Param("uid") Long uid, @Param("day") LocalDate day);

    /** 只撈 (date, calories) 兩欄，視窗彙總用 */
    @Query("""
           select m.mealDate as mealDate, m.calories as calories from MealEntry m
           where m.userId = :uid and m.mealDate >= :from
           order by m.mealDate asc
           """)
    List<DayCalories> findCaloriesSince(@Param("uid") Long uid, @Param("from") LocalDate from);

    @Query("""
           select distinct m.mealDate from MealEntry m
           where m.userId = :uid and m.mealDate >= :from
           """)
    List<LocalDate> findDistinctDatesSince(@Param("uid") Long uid, @Param("from") LocalDate from);

    interface DayCalories {
        LocalDate getMealDate();
        Double getCalories();
    }
}
