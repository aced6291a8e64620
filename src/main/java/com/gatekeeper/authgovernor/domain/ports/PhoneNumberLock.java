package com.gatekeeper.authgovernor.domain.ports;

/**
 * Per-phone-number exclusive lock held until the surrounding transaction ends.
 */
public interface PhoneNumberLock {

    /**
     * Blocks until the lock for {@code phoneNumber} is held by the current transaction.
     * Must be called inside a transaction.
     */
    void acquire(String phoneNumber);
}
