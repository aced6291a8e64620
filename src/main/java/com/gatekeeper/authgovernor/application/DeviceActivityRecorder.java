package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.infrastructure.jpa.SpringDeviceSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Bumps {@code last_used_at} off the request thread.
 */
@Component
public class DeviceActivityRecorder {

    private static final Logger log = LoggerFactory.getLogger(DeviceActivityRecorder.class);

    private final SpringDeviceSessionRepository sessions;
    private final Clock clock;

    public DeviceActivityRecorder(SpringDeviceSessionRepository sessions, Clock clock) {
        this.sessions = sessions;
        this.clock = clock;
    }

    @Async
    @Transactional
    public void touch(String sessionToken) {
        int updated = sessions.touch(sessionToken, OffsetDateTime.now(clock));
        if (updated == 0) {
            log.debug("Touch skipped, session no longer active");
        }
    }
}
