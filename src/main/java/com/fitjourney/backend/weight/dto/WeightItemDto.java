package com.fitjourney.backend.weight.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/** 一天一筆；lbs 由 kg 換算（捨去到 0.1） */
public record WeightItemDto(LocalDate logDate, BigDecimal weightKg, BigDecimal weightLbs) {}
