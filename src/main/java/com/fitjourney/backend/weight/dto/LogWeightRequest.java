package com.fitjourney.backend.weight.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * kg / lbs 任一必填，缺的由後端換算；兩個都有時以 kg 為準。
 * 合理範圍（20 ~ 400 kg）在 service 換算後再檢查。
 */
public record LogWeightRequest(
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("1000") BigDecimal weightKg,
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("2000") BigDecimal weightLbs,
        /** null = 今天；可回填，但不能是未來 */
        LocalDate logDate
) {}
