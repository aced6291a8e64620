package com.gatekeeper.authgovernor.api.dto;

import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AttemptView(
        UUID id,
        String phoneNumber,
        AttemptType attemptType,
        AttemptResult result,
        OffsetDateTime attemptedAt,
        String ipAddress,
        String userAgent,
        String deviceId,
        String failureReason,
        UUID relatedBlockId
) {

    public static AttemptView from(AttemptRecord a) {
        return new AttemptView(a.getId(), a.getPhoneNumber(), a.getAttemptType(), a.getResult(), a.getAttemptedAt(),
                a.getIpAddress(), a.getUserAgent(), a.getDeviceId(), a.getFailureReason(), a.getRelatedBlockId());
    }
}
