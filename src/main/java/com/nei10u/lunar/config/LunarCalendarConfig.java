package com.nei10u.lunar.config;

import com.nei10u.lunar.calendar.LunarCalendar;
import com.nei10u.lunar.calendar.SolarTermCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.ZoneId;

@Configuration
public class LunarCalendarConfig {

    private static final Logger log = LoggerFactory.getLogger(LunarCalendarConfig.class);

    /**
     * 节气换算日期所用的当地时区，留空则取 JVM 默认时区。
     */
    @Value("${lunar.zone-id:}")
    private String zoneId;

    @Bean
    public SolarTermCalculator solarTermCalculator() {
        ZoneId zone = StringUtils.hasText(zoneId) ? ZoneId.of(zoneId.trim()) : ZoneId.systemDefault();
        log.info("solar term zone: {}", zone);
        return new SolarTermCalculator(zone);
    }

    @Bean
    public LunarCalendar lunarCalendar(SolarTermCalculator solarTermCalculator) {
        return new LunarCalendar(solarTermCalculator);
    }
}
