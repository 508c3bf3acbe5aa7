package com.fitjourney.backend.meal.dto;

import java.time.Instant;
import java.time.LocalDate;

public record MealItemDto(
        Long id,
        LocalDate mealDate,
        String name,
        double calories,
        double proteinG,
        Double carbsG,
        Double fatG,
        Instant createdAt
) {}
