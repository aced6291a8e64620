package com.gatekeeper.authgovernor.support;

import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringAttemptRecordRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringAuthGuardLockRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringDeviceSessionRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringSecurityBlockRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringUserRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * Shared Spring context for database-backed tests. Every test starts on an empty
 * schema with the clock at {@link GovernorTestConfig#START}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(GovernorTestConfig.class)
public abstract class IntegrationTestSupport {

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected SpringAttemptRecordRepository attemptRepository;

    @Autowired
    protected SpringSecurityBlockRepository blockRepository;

    @Autowired
    protected SpringDeviceSessionRepository sessionRepository;

    @Autowired
    protected SpringUserRepository userRepository;

    @Autowired
    protected SpringAuthGuardLockRepository lockRepository;

    @Autowired
    protected PasswordEncoder passwordEncoder;

    @Autowired
    protected RecordingNotifier notifier;

    @BeforeEach
    void resetState() {
        clock.set(GovernorTestConfig.START);
        notifier.clear();
        attemptRepository.deleteAllInBatch();
        blockRepository.deleteAllInBatch();
        sessionRepository.deleteAllInBatch();
        lockRepository.deleteAllInBatch();
        userRepository.deleteAll();
    }

    protected UserEntity createUser(String phoneNumber, String password, UserType userType, String... roles) {
        UserEntity user = new UserEntity();
        user.setId(UUID.randomUUID());
        user.setPhoneNumber(phoneNumber);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setFullName("Test " + userType);
        user.setUserType(userType);
        user.setMaxAllowedDevices(2);
        user.setCreatedAt(OffsetDateTime.now(clock));
        user.setRoles(Set.of(roles));
        return userRepository.save(user);
    }

    protected OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
