package com.gatekeeper.authgovernor.infrastructure.adapters;

import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.FailedAttemptSummary;
import com.gatekeeper.authgovernor.domain.SecurityBlock;
import com.gatekeeper.authgovernor.domain.device.DeviceSession;
import com.gatekeeper.authgovernor.infrastructure.jpa.AttemptRecordEntity;
import com.gatekeeper.authgovernor.infrastructure.jpa.DeviceSessionEntity;
import com.gatekeeper.authgovernor.infrastructure.jpa.SecurityBlockEntity;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between JPA entities and domain models.
 */
public final class SecurityRecordMapper {

    private SecurityRecordMapper() {
    }

    public static AttemptRecordEntity toEntity(AttemptRecord a) {
        AttemptRecordEntity e = new AttemptRecordEntity();
        e.setId(a.getId());
        e.setPhoneNumber(a.getPhoneNumber());
        e.setAttemptType(a.getAttemptType());
        e.setResult(a.getResult());
        e.setAttemptedAt(a.getAttemptedAt());
        e.setIpAddress(a.getIpAddress());
        e.setUserAgent(a.getUserAgent());
        e.setDeviceId(a.getDeviceId());
        e.setFailureReason(a.getFailureReason());
        e.setRelatedBlockId(a.getRelatedBlockId());
        return e;
    }

    public static AttemptRecord toDomain(AttemptRecordEntity e) {
        return new AttemptRecord(e.getId(), e.getPhoneNumber(), e.getAttemptType(), e.getResult(),
                e.getAttemptedAt(), e.getIpAddress(), e.getUserAgent(), e.getDeviceId(),
                e.getFailureReason(), e.getRelatedBlockId());
    }

    public static SecurityBlockEntity toEntity(SecurityBlock b) {
        SecurityBlockEntity e = new SecurityBlockEntity();
        e.setId(b.getId());
        e.setPhoneNumber(b.getPhoneNumber());
        e.setBlockType(b.getBlockType());
        e.setBlockedAt(b.getBlockedAt());
        e.setBlockedUntil(b.getBlockedUntil());
        e.setBlockLevel(b.getBlockLevel());
        e.setConsecutiveBlocks(b.getConsecutiveBlocks());
        e.setActive(b.isActive());
        e.setManuallyUnblocked(b.isManuallyUnblocked());
        e.setUnblockedBy(b.getUnblockedBy());
        e.setUnblockedAt(b.getUnblockedAt());
        e.setUnblockReason(b.getUnblockReason());
        List<Map<String, String>> evidence = new ArrayList<>();
        for (FailedAttemptSummary s : b.getFailedAttempts()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("timestamp", s.timestamp() == null ? null : s.timestamp().toString());
            entry.put("ip_address", s.ipAddress());
            entry.put("device_id", s.deviceId());
            entry.put("failure_reason", s.failureReason());
            evidence.add(entry);
        }
        e.setFailedAttempts(evidence);
        e.setIpAddresses(new ArrayList<>(b.getIpAddresses()));
        e.setUserAgents(new ArrayList<>(b.getUserAgents()));
        e.setDeviceIds(new ArrayList<>(b.getDeviceIds()));
        return e;
    }

    public static SecurityBlock toDomain(SecurityBlockEntity e) {
        List<FailedAttemptSummary> evidence = new ArrayList<>();
        if (e.getFailedAttempts() != null) {
            for (Map<String, String> entry : e.getFailedAttempts()) {
                String ts = entry.get("timestamp");
                evidence.add(new FailedAttemptSummary(
                        ts == null ? null : OffsetDateTime.parse(ts),
                        entry.get("ip_address"),
                        entry.get("device_id"),
                        entry.get("failure_reason")));
            }
        }
        return new SecurityBlock(e.getId(), e.getPhoneNumber(), e.getBlockType(), e.getBlockedAt(),
                e.getBlockedUntil(), e.getBlockLevel(), e.getConsecutiveBlocks(), e.isActive(),
                e.isManuallyUnblocked(), e.getUnblockedBy(), e.getUnblockedAt(), e.getUnblockReason(),
                evidence, e.getIpAddresses(), e.getUserAgents(), e.getDeviceIds());
    }

    public static DeviceSession toDomain(DeviceSessionEntity e) {
        return new DeviceSession(e.getId(), e.getUserId(), e.getDeviceId(), e.getDeviceName(),
                e.getIpAddress(), e.getUserAgent(), e.getLoggedInAt(), e.getLastUsedAt(),
                e.isActive(), e.getDeactivatedAt(), e.getDeactivationReason());
    }
}
