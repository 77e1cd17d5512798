package com.loadforecast.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ForecastConfig {

    /** UTC system clock; replaced in tests to pin "today" for the fallback forecast. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
