package se.snapup_be.service;

import org.springframework.stereotype.Component;
import se.snapup_be.pojo.EscrowHold;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a hold may be released at a given instant. The release time is the
 * one stamped on the hold at creation; disputes block release without moving it.
 */
@Component
public class EscrowReleasePolicy {

    public ReleaseDecision evaluateRelease(EscrowHold hold, Instant now) {
        Instant releaseAt = hold.getReleaseAt();
        switch (hold.getStatus()) {
            case RELEASED:
                return ReleaseDecision.settled(releaseAt);
            case DISPUTED:
                return ReleaseDecision.blocked(releaseAt);
            case PENDING:
            default:
                if (!now.isBefore(releaseAt)) {
                    return ReleaseDecision.release(releaseAt);
                }
                return ReleaseDecision.waitFor(releaseAt, Duration.between(now, releaseAt));
        }
    }
}
