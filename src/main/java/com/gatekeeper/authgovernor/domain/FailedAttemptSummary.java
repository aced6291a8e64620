package com.gatekeeper.authgovernor.domain;

import java.time.OffsetDateTime;

/**
 * Evidence entry kept on a block for one of the failures that triggered it.
 */
public record FailedAttemptSummary(OffsetDateTime timestamp, String ipAddress, String deviceId, String failureReason) {

    public static FailedAttemptSummary of(AttemptRecord attempt) {
        return new FailedAttemptSummary(attempt.getAttemptedAt(), attempt.getIpAddress(),
                attempt.getDeviceId(), attempt.getFailureReason());
    }
}
