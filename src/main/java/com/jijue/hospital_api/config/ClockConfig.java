package com.jijue.hospital_api.config;

import java.time.Clock;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Hospital-local clock. Opening hours, chat availability and "today" are all
 * judged against this zone rather than the server's.
 */
@Configuration
public class ClockConfig {

    private static final Logger logger = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public Clock clock(@Value("${app.timezone:Africa/Nairobi}") String timezone) {
        ZoneId zone = ZoneId.of(timezone);
        logger.info("Using hospital time zone {}", zone);
        return Clock.system(zone);
    }
}
