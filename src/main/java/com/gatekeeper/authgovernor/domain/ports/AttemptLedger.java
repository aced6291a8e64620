package com.gatekeeper.authgovernor.domain.ports;

import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.AttemptType;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Append-only store of authentication attempts.
 */
public interface AttemptLedger {

    AttemptRecord append(AttemptRecord attempt);

    /** Failed attempts of the given type with {@code attemptedAt >= since}. */
    long countFailedSince(String phoneNumber, AttemptType attemptType, OffsetDateTime since);

    /** Most recent failed attempts of the given type, newest first. */
    List<AttemptRecord> findRecentFailed(String phoneNumber, AttemptType attemptType, int limit);

    /** Deletes attempts older than the cutoff; returns the count removed. */
    int purgeOlderThan(OffsetDateTime cutoff);
}
