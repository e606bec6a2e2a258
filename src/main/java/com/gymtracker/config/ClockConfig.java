package com.gymtracker.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class ClockConfig {

    // 为空时使用服务器默认时区
    @Value("${gym.schedule.zone:}")
    private String zone;

    @Bean
    public Clock clock() {
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        log.info("日历时区: {}", zoneId);
        return Clock.system(zoneId);
    }
}
