package com.gatekeeper.authgovernor.config;

import com.gatekeeper.authgovernor.domain.PhoneNumbers;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringUserRepository;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

@Configuration
public class BootstrapAdminRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    @Bean
    ApplicationRunner seedFirstAdmin(
            SpringUserRepository users,
            PasswordEncoder encoder,
            Clock clock,
            SecurityGovernorProperties properties,
            @Value("${bootstrap.admin.phone:}") String adminPhone,
            @Value("${bootstrap.admin.password:}") String adminPassword
    ) {
        return args -> {
            if (adminPhone == null || adminPhone.isBlank() || adminPassword == null || adminPassword.isBlank()) {
                log.warn("Bootstrap admin not created - set bootstrap.admin.phone and bootstrap.admin.password");
                return;
            }

            String phone = adminPhone.trim();
            if (users.existsByPhoneNumber(phone)) {
                log.info("Bootstrap admin exists: {}", PhoneNumbers.mask(phone));
                return;
            }

            UserEntity u = new UserEntity();
            u.setId(UUID.randomUUID());
            u.setPhoneNumber(phone);
            u.setPasswordHash(encoder.encode(adminPassword));
            u.setFullName("Administrator");
            u.setUserType(UserType.STAFF);
            u.setMaxAllowedDevices(properties.getDevices().getDefaultMaxAllowedDevices());
            u.setCreatedAt(OffsetDateTime.now(clock));
            u.setRoles(Set.of("ADMIN"));
            users.save(u);

            log.info("Bootstrap admin created: {}", PhoneNumbers.mask(phone));
        };
    }
}
