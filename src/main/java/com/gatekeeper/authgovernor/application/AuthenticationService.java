// ==============================================================================
// AuthenticationService.java - Login and password reset behind the block engine
// File: src/main/java/com/gatekeeper/authgovernor/application/AuthenticationService.java
// ==============================================================================

package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.config.JwtService;
import com.gatekeeper.authgovernor.config.SecurityGovernorProperties;
import com.gatekeeper.authgovernor.domain.AttemptDecision;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.domain.device.SessionRegistration;
import com.gatekeeper.authgovernor.domain.ports.NotifierPort;
import com.gatekeeper.authgovernor.exception.InvalidCredentialsException;
import com.gatekeeper.authgovernor.exception.RateLimitedException;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringUserRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Orchestrates the block gate, credential check, attempt recording and device registration.
 *
 * <p>Methods here are not transactional: the block engine and the device governor
 * commit their own units of work.
 */
@Service
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    public static final String INVALID_LOGIN_MESSAGE = "Invalid phone number or password";
    public static final String INVALID_RESET_CODE_MESSAGE = "Invalid or expired reset code";
    public static final String RESET_REQUESTED_MESSAGE =
            "If this number is registered, a password reset code has been sent to it.";

    private final ProgressiveBlockService blocking;
    private final DeviceSessionService devices;
    private final SpringUserRepository users;
    private final PasswordEncoder encoder;
    private final JwtService jwt;
    private final NotifierPort notifier;
    private final Clock clock;
    private final Duration resetCodeTtl;
    private final String dummyHash;
    private final SecureRandom random = new SecureRandom();

    public AuthenticationService(ProgressiveBlockService blocking,
                                 DeviceSessionService devices,
                                 SpringUserRepository users,
                                 PasswordEncoder encoder,
                                 JwtService jwt,
                                 NotifierPort notifier,
                                 Clock clock,
                                 SecurityGovernorProperties properties) {
        this.blocking = blocking;
        this.devices = devices;
        this.users = users;
        this.encoder = encoder;
        this.jwt = jwt;
        this.notifier = notifier;
        this.clock = clock;
        this.resetCodeTtl = Duration.ofMinutes(properties.getPasswordReset().getCodeTtlMinutes());
        // compared against when the number is unknown so both paths cost one hash check
        this.dummyHash = encoder.encode(UUID.randomUUID().toString());
    }

    // ===================================================================================
    // LOGIN
    // ===================================================================================

    public LoginResult login(String phoneNumber, String password, ClientContext client) {
        String phone = phoneNumber.trim();
        rejectIfBlocked(phone, AttemptType.LOGIN, client);

        Optional<UserEntity> user = users.findByPhoneNumber(phone);
        boolean passwordOk = hashMatches(password, user.map(UserEntity::getPasswordHash).orElse(null));
        boolean success = user.isPresent() && passwordOk;

        String failureReason = success ? null : user.isPresent() ? "wrong password" : "unknown phone number";
        AttemptDecision decision = blocking.recordAttempt(phone, AttemptType.LOGIN, success,
                client.ipAddress(), client.userAgent(), client.deviceId(), failureReason);

        if (decision.isBlocked()) {
            throw new RateLimitedException(decision.getBlockInfo());
        }
        if (!success) {
            throw new InvalidCredentialsException(INVALID_LOGIN_MESSAGE, decision.getRemainingAttempts());
        }

        UserEntity account = user.get();
        SessionRegistration registration = null;
        if (devices.isCapped(account.getUserType())) {
            registration = devices.registerSession(account.getId(), client.deviceId(), client.deviceName(),
                    client.ipAddress(), client.userAgent());
        }

        String token = jwt.generateToken(account.getPhoneNumber(), account.getId(), account.getRoles(),
                account.getUserType(), registration == null ? null : registration.sessionToken());

        log.info("✅ Login succeeded for {} ({}){}", PhoneNumbers.mask(phone), account.getUserType(),
                registration == null ? "" : registration.reused() ? " on known device" : " on new device");

        return new LoginResult(token, jwt.getTtlSeconds(), account.getId(), account.getPhoneNumber(),
                account.getFullName(), account.getUserType(), account.getRoles(), registration);
    }

    // ===================================================================================
    // PASSWORD RESET
    // ===================================================================================

    /**
     * Issues a reset code when the number is registered. The reply never says whether it is.
     */
    public String requestPasswordReset(String phoneNumber, ClientContext client) {
        String phone = phoneNumber.trim();
        rejectIfBlocked(phone, AttemptType.PASSWORD_RESET, client);

        Optional<UserEntity> user = users.findByPhoneNumber(phone);
        if (user.isPresent()) {
            String code = String.format("%06d", random.nextInt(1_000_000));
            UserEntity account = user.get();
            account.setResetCodeHash(encoder.encode(code));
            account.setResetCodeIssuedAt(OffsetDateTime.now(clock));
            users.save(account);
            notifier.passwordResetCodeIssued(phone, code);
            log.info("Password reset code issued for {}", PhoneNumbers.mask(phone));
        } else {
            encoder.matches(phone, dummyHash);
            log.info("Password reset requested for unregistered number {}", PhoneNumbers.mask(phone));
        }
        return RESET_REQUESTED_MESSAGE;
    }

    public void confirmPasswordReset(String phoneNumber, String code, String newPassword, ClientContext client) {
        String phone = phoneNumber.trim();
        rejectIfBlocked(phone, AttemptType.PASSWORD_RESET, client);

        Optional<UserEntity> user = users.findByPhoneNumber(phone);
        boolean codeMatches = hashMatches(code, user.map(UserEntity::getResetCodeHash).orElse(null));
        boolean fresh = user.map(UserEntity::getResetCodeIssuedAt)
                .map(issued -> !OffsetDateTime.now(clock).isAfter(issued.plus(resetCodeTtl)))
                .orElse(false);
        boolean success = codeMatches && fresh;

        String failureReason = success ? null : user.isEmpty() ? "unknown phone number"
                : codeMatches ? "reset code expired" : "wrong reset code";
        AttemptDecision decision = blocking.recordAttempt(phone, AttemptType.PASSWORD_RESET, success,
                client.ipAddress(), client.userAgent(), client.deviceId(), failureReason);

        if (decision.isBlocked()) {
            throw new RateLimitedException(decision.getBlockInfo());
        }
        if (!success) {
            throw new InvalidCredentialsException(INVALID_RESET_CODE_MESSAGE, decision.getRemainingAttempts());
        }

        UserEntity account = user.get();
        account.setPasswordHash(encoder.encode(newPassword));
        account.clearResetCode();
        users.save(account);
        log.info("✅ Password reset completed for {}", PhoneNumbers.mask(phone));
    }

    // ===================================================================================
    // HELPERS
    // ===================================================================================

    private void rejectIfBlocked(String phone, AttemptType attemptType, ClientContext client) {
        blocking.checkBlocked(phone, attemptType, client.ipAddress(), client.userAgent(), client.deviceId())
                .ifPresent(info -> {
                    throw new RateLimitedException(info);
                });
    }

    private boolean hashMatches(String raw, String hash) {
        if (raw == null) {
            return false;
        }
        if (hash == null) {
            encoder.matches(raw, dummyHash);
            return false;
        }
        return encoder.matches(raw, hash);
    }

    public record LoginResult(
            String accessToken,
            long expiresInSeconds,
            UUID userId,
            String phoneNumber,
            String fullName,
            UserType userType,
            Set<String> roles,
            SessionRegistration session
    ) {
    }
}
