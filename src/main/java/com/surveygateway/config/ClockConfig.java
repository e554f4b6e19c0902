package com.surveygateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * UTC wall clock used for admission decisions. Tests replace it with a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
