package se.snapup_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.snapup_be.exception.ErrorCode;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.enums.EscrowStatus;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EscrowReleasePolicy Unit Tests")
class EscrowReleasePolicyTest {

    private static final Instant CONFIRMED = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant RELEASE_AT = CONFIRMED.plus(Duration.ofHours(48));

    private final EscrowReleasePolicy policy = new EscrowReleasePolicy();

    private EscrowHold hold(EscrowStatus status) {
        return EscrowHold.builder()
                .amount(90000L)
                .status(status)
                .deliveryConfirmedAt(CONFIRMED)
                .releaseAt(RELEASE_AT)
                .build();
    }

    @Test
    @DisplayName("Pending hold waits until the release time")
    void pendingBeforeReleaseWaits() {
        ReleaseDecision decision = policy.evaluateRelease(hold(EscrowStatus.PENDING), RELEASE_AT.minusSeconds(90));

        assertThat(decision.getType()).isEqualTo(ReleaseDecisionType.WAIT);
        assertThat(decision.getRemaining()).isEqualTo(Duration.ofSeconds(90));
        assertThat(decision.getReleaseAt()).isEqualTo(RELEASE_AT);
    }

    @Test
    @DisplayName("Pending hold is released exactly at the release time")
    void pendingAtReleaseTimeReleases() {
        assertThat(policy.evaluateRelease(hold(EscrowStatus.PENDING), RELEASE_AT).getType())
                .isEqualTo(ReleaseDecisionType.RELEASE);
        assertThat(policy.evaluateRelease(hold(EscrowStatus.PENDING), RELEASE_AT.plusSeconds(3600)).getType())
                .isEqualTo(ReleaseDecisionType.RELEASE);
    }

    @Test
    @DisplayName("Disputed hold is blocked even long after the release time")
    void disputedIsBlocked() {
        ReleaseDecision decision = policy.evaluateRelease(hold(EscrowStatus.DISPUTED), RELEASE_AT.plus(Duration.ofDays(7)));

        assertThat(decision.getType()).isEqualTo(ReleaseDecisionType.BLOCKED);
        assertThat(decision.getReason()).isEqualTo(ErrorCode.HOLD_DISPUTE_ACTIVE);
    }

    @Test
    @DisplayName("Released hold is settled")
    void releasedIsSettled() {
        assertThat(policy.evaluateRelease(hold(EscrowStatus.RELEASED), RELEASE_AT.plusSeconds(1)).getType())
                .isEqualTo(ReleaseDecisionType.SETTLED);
    }
}
