package com.fitjourney.backend.meal.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(
        name = "meals",
        indexes = @Index(name = "idx_meals_user_date", columnList = "user_id,meal_date")
)
public class MealEntry {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** UTC 日曆日（所有任務條件都以這個欄位分天） */
    @Column(name = "meal_date", nullable = false)
    private LocalDate mealDate;

    @Column(length = 128)
    private String name;

    @Column(nullable = false)
    private Double calories = 0.0;

    @Column(name = "protein_g", nullable = false)
    private Double proteinG = 0.0;

    @Column(name = "carbs_g")
    private Double carbsG;

    @Column(name = "fat_g")
    private Double fatG;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
