package com.fitjourney.backend.meal.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record LogMealRequest(
        /** null = 今天（UTC） */
        LocalDate mealDate,
        @Size(max = 128) String name,
        @NotNull @DecimalMin("0") @DecimalMax("10000") Double calories,
        @DecimalMin("0") @DecimalMax("1000") Double proteinG,
        @DecimalMin("0") @DecimalMax("2000") Double carbsG,
        @DecimalMin("0") @DecimalMax("1000") Double fatG
) {}
