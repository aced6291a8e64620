package com.gatekeeper.authgovernor.support;

import com.gatekeeper.authgovernor.infrastructure.notify.LoggingNotifier;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;

@TestConfiguration
public class GovernorTestConfig {

    public static final Instant START = Instant.parse("2026-01-05T08:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START);
    }

    @Bean
    @Primary
    public RecordingNotifier recordingNotifier() {
        return new RecordingNotifier(new LoggingNotifier());
    }
}
