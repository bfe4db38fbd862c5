package com.eyelevel.documentanalysis.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * The clock used for all run timestamps and staleness checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
