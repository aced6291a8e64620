package com.gatekeeper.authgovernor.config;

import com.gatekeeper.authgovernor.domain.UserType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Thresholds for progressive blocking, device caps, password reset and maintenance.
 */
@Configuration
@ConfigurationProperties(prefix = "app.security")
public class SecurityGovernorProperties {
    private Blocking blocking = new Blocking();
    private Devices devices = new Devices();
    private PasswordReset passwordReset = new PasswordReset();
    private Maintenance maintenance = new Maintenance();

    public Blocking getBlocking() { return blocking; }
    public void setBlocking(Blocking blocking) { this.blocking = blocking; }

    public Devices getDevices() { return devices; }
    public void setDevices(Devices devices) { this.devices = devices; }

    public PasswordReset getPasswordReset() { return passwordReset; }
    public void setPasswordReset(PasswordReset passwordReset) { this.passwordReset = passwordReset; }

    public Maintenance getMaintenance() { return maintenance; }
    public void setMaintenance(Maintenance maintenance) { this.maintenance = maintenance; }

    public static class Blocking {
        private int maxFailedAttempts = 3;
        private int attemptWindowMinutes = 60;
        /** Ascending; level N uses entry N-1, levels past the end reuse the last entry. */
        private List<Integer> blockDurationsMinutes = new ArrayList<>(List.of(15, 60, 360, 1440, 10080));
        private int resetAfterHours = 168;
        private int evidenceUserAgentMaxLength = 100;

        public int getMaxFailedAttempts() { return maxFailedAttempts; }
        public void setMaxFailedAttempts(int maxFailedAttempts) { this.maxFailedAttempts = maxFailedAttempts; }

        public int getAttemptWindowMinutes() { return attemptWindowMinutes; }
        public void setAttemptWindowMinutes(int attemptWindowMinutes) { this.attemptWindowMinutes = attemptWindowMinutes; }

        public List<Integer> getBlockDurationsMinutes() { return blockDurationsMinutes; }
        public void setBlockDurationsMinutes(List<Integer> blockDurationsMinutes) { this.blockDurationsMinutes = blockDurationsMinutes; }

        public int getResetAfterHours() { return resetAfterHours; }
        public void setResetAfterHours(int resetAfterHours) { this.resetAfterHours = resetAfterHours; }

        public int getEvidenceUserAgentMaxLength() { return evidenceUserAgentMaxLength; }
        public void setEvidenceUserAgentMaxLength(int evidenceUserAgentMaxLength) { this.evidenceUserAgentMaxLength = evidenceUserAgentMaxLength; }

        public Duration attemptWindow() {
            return Duration.ofMinutes(attemptWindowMinutes);
        }

        public Duration resetAfter() {
            return Duration.ofHours(resetAfterHours);
        }

        public int maxBlockLevel() {
            return blockDurationsMinutes.size();
        }

        public Duration durationForLevel(int level) {
            int index = Math.min(Math.max(level, 1), blockDurationsMinutes.size()) - 1;
            return Duration.ofMinutes(blockDurationsMinutes.get(index));
        }

        /** Fails fast on a configuration the engine cannot honour. */
        public void validate() {
            if (maxFailedAttempts < 1) {
                throw new IllegalArgumentException("app.security.blocking.max-failed-attempts must be >= 1");
            }
            if (attemptWindowMinutes < 1) {
                throw new IllegalArgumentException("app.security.blocking.attempt-window-minutes must be >= 1");
            }
            if (blockDurationsMinutes == null || blockDurationsMinutes.isEmpty()) {
                throw new IllegalArgumentException("app.security.blocking.block-durations-minutes must not be empty");
            }
            int previous = 0;
            for (Integer minutes : blockDurationsMinutes) {
                if (minutes == null || minutes < 1 || minutes < previous) {
                    throw new IllegalArgumentException(
                            "app.security.blocking.block-durations-minutes must be positive and ascending: " + blockDurationsMinutes);
                }
                previous = minutes;
            }
        }
    }

    public static class Devices {
        private int defaultMaxAllowedDevices = 2;
        private Set<UserType> cappedUserTypes = EnumSet.of(UserType.STUDENT);
        /** Accept credentials issued before session tokens existed. */
        private boolean allowLegacyTokens = true;

        public int getDefaultMaxAllowedDevices() { return defaultMaxAllowedDevices; }
        public void setDefaultMaxAllowedDevices(int defaultMaxAllowedDevices) { this.defaultMaxAllowedDevices = defaultMaxAllowedDevices; }

        public Set<UserType> getCappedUserTypes() { return cappedUserTypes; }
        public void setCappedUserTypes(Set<UserType> cappedUserTypes) { this.cappedUserTypes = cappedUserTypes; }

        public boolean isAllowLegacyTokens() { return allowLegacyTokens; }
        public void setAllowLegacyTokens(boolean allowLegacyTokens) { this.allowLegacyTokens = allowLegacyTokens; }
    }

    public static class PasswordReset {
        private int codeTtlMinutes = 10;

        public int getCodeTtlMinutes() { return codeTtlMinutes; }
        public void setCodeTtlMinutes(int codeTtlMinutes) { this.codeTtlMinutes = codeTtlMinutes; }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private int retentionDays = 30;
        private String cron = "0 30 3 * * *";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }
    }
}
