package com.fitjourney.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 所有「今天」的計算都從這個 Clock 取得（測試可換成 Clock.fixed）。
 * 紀錄日期一律以 UTC 日曆日為準，跟 meals.date / weigh_ins.date 寫入時一致。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.journey.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
