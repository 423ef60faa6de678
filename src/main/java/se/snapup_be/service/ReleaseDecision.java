package se.snapup_be.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import se.snapup_be.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReleaseDecision {

    private final ReleaseDecisionType type;
    private final Instant releaseAt;
    // WAIT only
    private final Duration remaining;
    // BLOCKED only
    private final ErrorCode reason;

    public static ReleaseDecision release(Instant releaseAt) {
        return new ReleaseDecision(ReleaseDecisionType.RELEASE, releaseAt, null, null);
    }

    public static ReleaseDecision waitFor(Instant releaseAt, Duration remaining) {
        return new ReleaseDecision(ReleaseDecisionType.WAIT, releaseAt, remaining, null);
    }

    public static ReleaseDecision blocked(Instant releaseAt) {
        return new ReleaseDecision(ReleaseDecisionType.BLOCKED, releaseAt, null, ErrorCode.HOLD_DISPUTE_ACTIVE);
    }

    public static ReleaseDecision settled(Instant releaseAt) {
        return new ReleaseDecision(ReleaseDecisionType.SETTLED, releaseAt, null, null);
    }

    public Long getRemainingSeconds() {
        return remaining != null ? remaining.getSeconds() : null;
    }
}
