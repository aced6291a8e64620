package com.gatekeeper.authgovernor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Single time source for windows, expiry and session timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
