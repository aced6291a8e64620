package com.gatekeeper.authgovernor.infrastructure.adapters;

import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.ports.PhoneNumberLock;
import com.gatekeeper.authgovernor.exception.CapacityRaceException;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringAuthGuardLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Row lock on {@code auth_guard_locks} keyed by phone number.
 */
@Component
public class JpaPhoneNumberLockAdapter implements PhoneNumberLock {
    private static final Logger log = LoggerFactory.getLogger(JpaPhoneNumberLockAdapter.class);

    private final SpringAuthGuardLockRepository locks;
    private final AuthGuardLockRowWriter rowWriter;

    public JpaPhoneNumberLockAdapter(SpringAuthGuardLockRepository locks, AuthGuardLockRowWriter rowWriter) {
        this.locks = locks;
        this.rowWriter = rowWriter;
    }

    static String keyFor(String phoneNumber) {
        return "phone:" + phoneNumber;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(String phoneNumber) {
        String key = keyFor(phoneNumber);
        if (locks.findForUpdate(key).isPresent()) {
            return;
        }
        try {
            rowWriter.ensureExists(key);
        } catch (DataAccessException | TransactionException e) {
            // the row writer's own transaction rolled back; the row may still exist from another writer
            log.warn("Creating lock row for {} failed ({}), locking the existing row",
                    PhoneNumbers.mask(phoneNumber), e.getMessage());
        }
        locks.findForUpdate(key).orElseThrow(() ->
                new CapacityRaceException("Lock row for " + PhoneNumbers.mask(phoneNumber) + " is not visible yet"));
        log.debug("Acquired phone lock for {} after creating its row", PhoneNumbers.mask(phoneNumber));
    }
}
