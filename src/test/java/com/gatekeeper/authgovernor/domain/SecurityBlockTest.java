package com.gatekeeper.authgovernor.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurityBlockTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 1, 5, 8, 0, 0, 0, ZoneOffset.UTC);

    private SecurityBlock block() {
        return SecurityBlock.open("01012345678", BlockType.LOGIN, NOW, Duration.ofMinutes(15), 1, 1,
                List.of(), List.of("10.0.0.1"), List.of(), List.of());
    }

    @Test
    void inForceUntilBlockedUntilExclusive() {
        SecurityBlock block = block();

        assertThat(block.isInForce(NOW)).isTrue();
        assertThat(block.isInForce(NOW.plusMinutes(15).minusSeconds(1))).isTrue();
        assertThat(block.isExpired(NOW.plusMinutes(15))).isTrue();
        assertThat(block.isInForce(NOW.plusMinutes(15))).isFalse();
        assertThat(block.remainingSeconds(NOW.plusMinutes(20))).isZero();
    }

    @Test
    void naturalExpiryKeepsStreak() {
        SecurityBlock block = block();
        block.expire();

        assertThat(block.isActive()).isFalse();
        assertThat(block.isManuallyUnblocked()).isFalse();
        assertThat(block.isInForce(NOW)).isFalse();
    }

    @Test
    void manualUnblockRecordsOperator() {
        SecurityBlock block = block();
        block.unblockManually("ops", NOW.plusMinutes(3), "verified");

        assertThat(block.isActive()).isFalse();
        assertThat(block.isManuallyUnblocked()).isTrue();
        assertThat(block.getUnblockedBy()).isEqualTo("ops");
        assertThat(block.getUnblockedAt()).isEqualTo(NOW.plusMinutes(3));
    }

    @Test
    void rejectsEmptyIntervalAndZeroLevel() {
        assertThatThrownBy(() -> new SecurityBlock(UUID.randomUUID(), "01012345678", BlockType.LOGIN, NOW, NOW,
                1, 1, true, false, null, null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SecurityBlock.open("01012345678", BlockType.LOGIN, NOW, Duration.ofMinutes(1), 0, 1,
                null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blockTypeCoverage() {
        assertThat(BlockType.covering(AttemptType.LOGIN)).containsExactlyInAnyOrder(BlockType.LOGIN, BlockType.COMBINED);
        assertThat(BlockType.COMBINED.covers(AttemptType.PASSWORD_RESET)).isTrue();
        assertThat(BlockType.LOGIN.covers(AttemptType.PASSWORD_RESET)).isFalse();
    }

    @Test
    void masksPhoneNumbers() {
        assertThat(PhoneNumbers.mask("01012345678")).isEqualTo("*******5678");
        assertThat(PhoneNumbers.mask("123")).isEqualTo("****");
        assertThat(PhoneNumbers.mask(null)).isEqualTo("****");
    }
}
