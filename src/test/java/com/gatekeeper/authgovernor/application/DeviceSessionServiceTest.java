package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.domain.device.DeactivationReason;
import com.gatekeeper.authgovernor.domain.device.DeviceCapUpdate;
import com.gatekeeper.authgovernor.domain.device.DeviceSession;
import com.gatekeeper.authgovernor.domain.device.SessionRegistration;
import com.gatekeeper.authgovernor.exception.ResourceNotFoundException;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import com.gatekeeper.authgovernor.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceSessionServiceTest extends IntegrationTestSupport {

    @Autowired
    private DeviceSessionService service;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private UserEntity student;

    @BeforeEach
    void createStudent() {
        student = createUser("01012345678", "secret-pass", UserType.STUDENT);
    }

    private SessionRegistration login(String deviceId) {
        SessionRegistration registration = service.registerSession(student.getId(), deviceId, "Device " + deviceId,
                "10.0.0.1", "JUnit");
        clock.advanceMinutes(5);
        return registration;
    }

    @Test
    void thirdDeviceEvictsLeastRecentlyUsed() {
        SessionRegistration a = login("A");
        SessionRegistration b = login("B");
        SessionRegistration c = login("C");

        assertThat(a.evicted()).isEmpty();
        assertThat(b.evicted()).isEmpty();
        assertThat(c.evicted()).extracting(DeviceSession::getId).containsExactly(a.session().getId());
        assertThat(c.evicted().get(0).getDeactivationReason()).isEqualTo(DeactivationReason.EVICTED.name());

        assertThat(service.validateSession(student.getId(), a.sessionToken())).isFalse();
        assertThat(service.validateSession(student.getId(), b.sessionToken())).isTrue();
        assertThat(service.validateSession(student.getId(), c.sessionToken())).isTrue();
        assertThat(service.countActive(student.getId())).isEqualTo(2);
    }

    @Test
    void evictionFollowsLastUseNotLoginOrder() {
        SessionRegistration a = login("A");
        SessionRegistration b = login("B");

        // A is used again after B logged in, so B becomes the idle one
        new TransactionTemplate(transactionManager)
                .executeWithoutResult(status -> sessionRepository.touch(a.sessionToken(), now()));
        clock.advanceMinutes(1);

        SessionRegistration c = login("C");

        assertThat(c.evicted()).extracting(DeviceSession::getId).containsExactly(b.session().getId());
        assertThat(service.validateSession(student.getId(), a.sessionToken())).isTrue();
    }

    @Test
    void repeatLoginFromSameDeviceReusesSession() {
        SessionRegistration first = login("A");
        SessionRegistration again = login("A");

        assertThat(again.reused()).isTrue();
        assertThat(again.session().getId()).isEqualTo(first.session().getId());
        assertThat(again.sessionToken()).isEqualTo(first.sessionToken());
        assertThat(again.session().getLastUsedAt()).isAfter(first.session().getLastUsedAt());
        assertThat(service.countActive(student.getId())).isEqualTo(1);
    }

    @Test
    void ipAddressIdentifiesDevicesWithoutDeclaredId() {
        SessionRegistration first = service.registerSession(student.getId(), null, "Android Device", "10.0.0.7", "UA");
        SessionRegistration sameIp = service.registerSession(student.getId(), "  ", "Android Device", "10.0.0.7", "UA");
        SessionRegistration otherIp = service.registerSession(student.getId(), null, "Android Device", "10.0.0.8", "UA");

        assertThat(sameIp.reused()).isTrue();
        assertThat(sameIp.session().getId()).isEqualTo(first.session().getId());
        assertThat(otherIp.reused()).isFalse();
        assertThat(service.countActive(student.getId())).isEqualTo(2);
    }

    @Test
    void declaredDeviceIdAdoptsSessionFirstSeenByIp() {
        SessionRegistration byIp = service.registerSession(student.getId(), null, "Android Device", "10.0.0.7", "UA");
        SessionRegistration other = service.registerSession(student.getId(), "tablet", "Tablet", "10.0.0.9", "UA");
        clock.advanceMinutes(1);

        SessionRegistration declared = service.registerSession(student.getId(), "phone-1", "Android Device",
                "10.0.0.7", "UA");

        assertThat(declared.reused()).isTrue();
        assertThat(declared.evicted()).isEmpty();
        assertThat(declared.session().getId()).isEqualTo(byIp.session().getId());
        assertThat(declared.session().getDeviceId()).isEqualTo("phone-1");
        assertThat(service.countActive(student.getId())).isEqualTo(2);
        assertThat(service.validateSession(student.getId(), other.sessionToken())).isTrue();

        SessionRegistration again = service.registerSession(student.getId(), "phone-1", null, "10.0.0.50", "UA");
        assertThat(again.session().getId()).isEqualTo(byIp.session().getId());
    }

    @Test
    void uncappedUsersKeepEverySession() {
        UserEntity teacher = createUser("01077777777", "secret-pass", UserType.TEACHER);
        for (int i = 0; i < 4; i++) {
            service.registerSession(teacher.getId(), "device-" + i, null, "10.0.0.1", "JUnit");
        }

        assertThat(service.isCapped(UserType.TEACHER)).isFalse();
        assertThat(service.countActive(teacher.getId())).isEqualTo(4);
    }

    @Test
    void loweringCapTrimsOldestSessions() {
        service.setDeviceCap(student.getId(), 3);
        SessionRegistration a = login("A");
        SessionRegistration b = login("B");
        SessionRegistration c = login("C");
        assertThat(service.countActive(student.getId())).isEqualTo(3);

        DeviceCapUpdate update = service.setDeviceCap(student.getId(), 1);

        assertThat(update.maxAllowedDevices()).isEqualTo(1);
        assertThat(update.activeSessions()).isEqualTo(1);
        assertThat(update.deactivated()).extracting(DeviceSession::getId)
                .containsExactly(a.session().getId(), b.session().getId());
        assertThat(service.validateSession(student.getId(), c.sessionToken())).isTrue();
        assertThat(service.getDeviceCap(student.getId())).isEqualTo(1);
    }

    @Test
    void capMustBePositive() {
        assertThatThrownBy(() -> service.setDeviceCap(student.getId(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void revokeIsIdempotent() {
        SessionRegistration a = login("A");

        DeviceSession revoked = service.revoke(student.getId(), a.session().getId());
        DeviceSession again = service.revoke(student.getId(), a.session().getId());

        assertThat(revoked.isActive()).isFalse();
        assertThat(again.getDeactivationReason()).isEqualTo(DeactivationReason.REVOKED.name());
        assertThat(service.validateSession(student.getId(), a.sessionToken())).isFalse();
    }

    @Test
    void revokeOfForeignSessionIsNotFound() {
        SessionRegistration a = login("A");
        UserEntity other = createUser("01088888888", "secret-pass", UserType.STUDENT);

        assertThatThrownBy(() -> service.revoke(other.getId(), a.session().getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void revokeAllEndsEverySession() {
        login("A");
        login("B");

        assertThat(service.revokeAll(student.getId())).isEqualTo(2);
        assertThat(service.listSessions(student.getId(), true)).isEmpty();
        assertThat(service.listSessions(student.getId(), false)).hasSize(2);
    }

    @Test
    void logoutEndsOnlyPresentedSession() {
        SessionRegistration a = login("A");
        SessionRegistration b = login("B");

        assertThat(service.logout(student.getId(), a.sessionToken())).isTrue();
        assertThat(service.logout(student.getId(), a.sessionToken())).isFalse();

        List<DeviceSession> active = service.listSessions(student.getId(), true);
        assertThat(active).extracting(DeviceSession::getId).containsExactly(b.session().getId());
        assertThat(service.findActiveByToken(student.getId(), b.sessionToken())).isPresent();
    }

    @Test
    void unknownUserIsNotFound() {
        assertThatThrownBy(() -> service.registerSession(UUID.randomUUID(), "A", null, "10.0.0.1", "JUnit"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> service.listSessions(UUID.randomUUID(), true))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
