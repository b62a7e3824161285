package com.gt.flashcards.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

// All due-date arithmetic happens in a single calendar zone, UTC unless configured otherwise.
@Configuration
public class ScheduleConfig {

    private static final Logger log = LoggerFactory.getLogger(ScheduleConfig.class);

    @Bean
    public Clock scheduleClock(@Value("${flashcards.schedule.zone:UTC}") String zoneId) {
        ZoneId zone = ZoneId.of(zoneId);
        log.info("Scheduling review dates in zone {}", zone);

        return Clock.system(zone);
    }
}
