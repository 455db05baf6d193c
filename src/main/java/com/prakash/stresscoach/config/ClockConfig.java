package com.prakash.stresscoach.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public Clock schedulerClock(SchedulerProperties properties) {
        String zoneId = properties.getZoneId();
        if (zoneId == null || zoneId.isBlank()) {
            return Clock.systemDefaultZone();
        }
        log.info("Scheduler clock using zone {}", zoneId);
        return Clock.system(ZoneId.of(zoneId));
    }
}
