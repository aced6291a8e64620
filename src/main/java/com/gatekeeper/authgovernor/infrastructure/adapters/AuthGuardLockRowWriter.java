package com.gatekeeper.authgovernor.infrastructure.adapters;

import com.gatekeeper.authgovernor.infrastructure.jpa.SpringAuthGuardLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Creates lock control rows in their own transaction so the row is committed
 * and lockable by the caller's transaction. The insert skips keys that already
 * exist, so a concurrent writer never fails the transaction.
 */
@Component
public class AuthGuardLockRowWriter {
    private static final Logger log = LoggerFactory.getLogger(AuthGuardLockRowWriter.class);

    private final SpringAuthGuardLockRepository locks;
    private final Clock clock;

    public AuthGuardLockRowWriter(SpringAuthGuardLockRepository locks, Clock clock) {
        this.locks = locks;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureExists(String lockKey) {
        if (locks.existsById(lockKey)) {
            return;
        }
        int written = locks.insertIfAbsent(lockKey, OffsetDateTime.now(clock));
        if (written > 0) {
            log.debug("Created lock row {}", lockKey);
        } else {
            log.debug("Lock row {} was created concurrently", lockKey);
        }
    }
}
