package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.config.SecurityGovernorProperties;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.domain.device.DeactivationReason;
import com.gatekeeper.authgovernor.domain.device.DeviceCapUpdate;
import com.gatekeeper.authgovernor.domain.device.DeviceSession;
import com.gatekeeper.authgovernor.domain.device.SessionRegistration;
import com.gatekeeper.authgovernor.exception.CapacityRaceException;
import com.gatekeeper.authgovernor.exception.ResourceNotFoundException;
import com.gatekeeper.authgovernor.infrastructure.adapters.SecurityRecordMapper;
import com.gatekeeper.authgovernor.infrastructure.jpa.DeviceSessionEntity;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringDeviceSessionRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringUserRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user device sessions with a cap enforced by least-recently-used eviction.
 * Registration and cap changes serialize on the user's row lock.
 */
@Service
public class DeviceSessionService {

    private static final Logger log = LoggerFactory.getLogger(DeviceSessionService.class);

    private static final int TOKEN_BYTES = 32;

    private final SpringDeviceSessionRepository sessions;
    private final SpringUserRepository users;
    private final DeviceActivityRecorder activity;
    private final Clock clock;
    private final SecurityGovernorProperties.Devices config;
    private final TransactionTemplate tx;
    private final SecureRandom random = new SecureRandom();

    public DeviceSessionService(SpringDeviceSessionRepository sessions,
                                SpringUserRepository users,
                                DeviceActivityRecorder activity,
                                Clock clock,
                                SecurityGovernorProperties properties,
                                PlatformTransactionManager transactionManager) {
        this.sessions = sessions;
        this.users = users;
        this.activity = activity;
        this.clock = clock;
        this.config = properties.getDevices();
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        log.info("DeviceSessionService initialized - capped types: {}, default cap: {}, legacy tokens allowed: {}",
                config.getCappedUserTypes(), config.getDefaultMaxAllowedDevices(), config.isAllowLegacyTokens());
    }

    public boolean isCapped(UserType userType) {
        return userType != null && config.getCappedUserTypes().contains(userType);
    }

    public boolean isLegacyTokenAllowed() {
        return config.isAllowLegacyTokens();
    }

    // ===================================================================================
    // LOGIN
    // ===================================================================================

    /**
     * Registers a verified login. The device is identified by {@code deviceId} when
     * supplied; failing that, by IP address among sessions that never declared one.
     * A repeat login from the same device refreshes its row and keeps its token.
     */
    public SessionRegistration registerSession(UUID userId, String deviceId, String deviceName,
                                               String ipAddress, String userAgent) {
        String normalizedDeviceId = deviceId == null || deviceId.isBlank() ? null : deviceId.trim();
        return withRaceRetry(userId, status ->
                doRegister(userId, normalizedDeviceId, deviceName, ipAddress, userAgent));
    }

    private SessionRegistration doRegister(UUID userId, String deviceId, String deviceName,
                                           String ipAddress, String userAgent) {
        UserEntity user = users.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        OffsetDateTime now = OffsetDateTime.now(clock);

        Optional<DeviceSessionEntity> existing = Optional.empty();
        if (deviceId != null) {
            existing = sessions.findFirstByUserIdAndDeviceIdAndActiveTrue(userId, deviceId);
        }
        if (existing.isEmpty() && ipAddress != null) {
            existing = sessions.findFirstByUserIdAndIpAddressAndDeviceIdIsNullAndActiveTrue(userId, ipAddress);
        }

        if (existing.isPresent()) {
            DeviceSessionEntity session = existing.get();
            if (session.getDeviceId() == null && deviceId != null) {
                // row was first seen by IP only; adopt the declared id
                session.setDeviceId(deviceId);
            }
            session.setLastUsedAt(now);
            session.setUserAgent(userAgent);
            if (deviceName != null) {
                session.setDeviceName(deviceName);
            }
            session.setIpAddress(ipAddress);
            sessions.save(session);
            log.info("📱 Reused device session {} for user {}", session.getId(), userId);
            return new SessionRegistration(SecurityRecordMapper.toDomain(session), session.getSessionToken(),
                    true, List.of());
        }

        List<DeviceSession> evicted = new ArrayList<>();
        if (isCapped(user.getUserType())) {
            int cap = Math.max(1, user.getMaxAllowedDevices());
            List<DeviceSessionEntity> active = new ArrayList<>(
                    sessions.findByUserIdAndActiveTrueOrderByLastUsedAtAscLoggedInAtAsc(userId));
            while (active.size() >= cap) {
                DeviceSessionEntity oldest = active.remove(0);
                oldest.deactivate(now, DeactivationReason.EVICTED.name());
                sessions.save(oldest);
                evicted.add(SecurityRecordMapper.toDomain(oldest));
                log.info("Evicted least recently used session {} (last used {}) for user {}",
                        oldest.getId(), oldest.getLastUsedAt(), userId);
            }
        }

        DeviceSessionEntity session = new DeviceSessionEntity();
        session.setUserId(userId);
        session.setSessionToken(newToken());
        session.setDeviceId(deviceId);
        session.setDeviceName(deviceName);
        session.setIpAddress(ipAddress);
        session.setUserAgent(userAgent);
        session.setLoggedInAt(now);
        session.setLastUsedAt(now);
        sessions.save(session);

        log.info("📱 Registered device session {} ({}) for user {}", session.getId(), deviceName, userId);
        return new SessionRegistration(SecurityRecordMapper.toDomain(session), session.getSessionToken(),
                false, evicted);
    }

    // ===================================================================================
    // REQUEST PATH
    // ===================================================================================

    /** True when the token belongs to an active session of this user. Takes no lock. */
    @Transactional(readOnly = true)
    public boolean validateSession(UUID userId, String sessionToken) {
        if (userId == null || sessionToken == null || sessionToken.isBlank()) {
            return false;
        }
        return sessions.existsByUserIdAndSessionTokenAndActiveTrue(userId, sessionToken);
    }

    public void touch(String sessionToken) {
        activity.touch(sessionToken);
    }

    // ===================================================================================
    // MANAGEMENT
    // ===================================================================================

    @Transactional(readOnly = true)
    public List<DeviceSession> listSessions(UUID userId, boolean activeOnly) {
        requireUser(userId);
        List<DeviceSessionEntity> rows = activeOnly
                ? sessions.findByUserIdAndActiveTrueOrderByLastUsedAtDesc(userId)
                : sessions.findByUserIdOrderByLastUsedAtDesc(userId);
        return rows.stream().map(SecurityRecordMapper::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public Optional<DeviceSession> findActiveByToken(UUID userId, String sessionToken) {
        if (sessionToken == null) {
            return Optional.empty();
        }
        return sessions.findByUserIdAndSessionTokenAndActiveTrue(userId, sessionToken)
                .map(SecurityRecordMapper::toDomain);
    }

    @Transactional(readOnly = true)
    public long countActive(UUID userId) {
        return sessions.countByUserIdAndActiveTrue(userId);
    }

    @Transactional(readOnly = true)
    public int getDeviceCap(UUID userId) {
        return requireUser(userId).getMaxAllowedDevices();
    }

    @Transactional
    public DeviceSession revoke(UUID userId, UUID sessionId) {
        DeviceSessionEntity session = sessions.findByIdAndUserId(sessionId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Device session not found: " + sessionId));
        if (session.isActive()) {
            session.deactivate(OffsetDateTime.now(clock), DeactivationReason.REVOKED.name());
            sessions.save(session);
            log.info("Revoked device session {} for user {}", sessionId, userId);
        }
        return SecurityRecordMapper.toDomain(session);
    }

    @Transactional
    public int revokeAll(UUID userId) {
        requireUser(userId);
        int count = sessions.deactivateAllForUser(userId, OffsetDateTime.now(clock), DeactivationReason.REVOKED.name());
        log.info("Revoked {} device session(s) for user {}", count, userId);
        return count;
    }

    /** Ends the session bound to the presented token. */
    @Transactional
    public boolean logout(UUID userId, String sessionToken) {
        Optional<DeviceSessionEntity> session = sessions.findByUserIdAndSessionTokenAndActiveTrue(userId, sessionToken);
        session.ifPresent(s -> {
            s.deactivate(OffsetDateTime.now(clock), DeactivationReason.LOGOUT.name());
            sessions.save(s);
            log.info("Device session {} logged out", s.getId());
        });
        return session.isPresent();
    }

    /**
     * Changes the cap. When it drops below the active count the least recently used
     * sessions are deactivated until it holds.
     */
    public DeviceCapUpdate setDeviceCap(UUID userId, int maxDevices) {
        if (maxDevices < 1) {
            throw new IllegalArgumentException("maxAllowedDevices must be at least 1");
        }
        return withRaceRetry(userId, status -> {
            UserEntity user = users.findByIdForUpdate(userId)
                    .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
            user.setMaxAllowedDevices(maxDevices);
            users.save(user);

            OffsetDateTime now = OffsetDateTime.now(clock);
            List<DeviceSessionEntity> active = new ArrayList<>(
                    sessions.findByUserIdAndActiveTrueOrderByLastUsedAtAscLoggedInAtAsc(userId));
            List<DeviceSession> trimmed = new ArrayList<>();
            while (active.size() > maxDevices) {
                DeviceSessionEntity oldest = active.remove(0);
                oldest.deactivate(now, DeactivationReason.CAP_REDUCED.name());
                sessions.save(oldest);
                trimmed.add(SecurityRecordMapper.toDomain(oldest));
            }
            if (!trimmed.isEmpty()) {
                log.warn("Cap for user {} lowered to {}, deactivated {} session(s)", userId, maxDevices, trimmed.size());
            } else {
                log.info("Cap for user {} set to {}", userId, maxDevices);
            }
            return new DeviceCapUpdate(userId, maxDevices, active.size(), trimmed);
        });
    }

    // ===================================================================================
    // HELPERS
    // ===================================================================================

    private UserEntity requireUser(UUID userId) {
        return users.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
    }

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private <T> T withRaceRetry(UUID userId, TransactionCallback<T> work) {
        try {
            return tx.execute(work);
        } catch (CapacityRaceException | ConcurrencyFailureException | TransactionException e) {
            log.warn("Concurrent device update for user {} ({}), retrying once", userId, e.getMessage());
            try {
                return tx.execute(work);
            } catch (ConcurrencyFailureException | TransactionException again) {
                throw new CapacityRaceException("Concurrent device update conflict for user " + userId, again);
            }
        }
    }
}
