package com.fitjourney.backend.journey.window;

import java.time.LocalDate;

/** 一筆帶日期的數值紀錄（一餐的熱量、一餐的蛋白質、一次體重...） */
public record DailyValue(LocalDate date, double value) {}
