package se.snapup_be.guard;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-identifier send quota. A slot is taken with {@link #tryAcquire} before the send and
 * given back with {@link #release} if the send does not go out.
 */
public interface RateLimiter {

    /**
     * @return true if one more send fits in the current window
     */
    boolean isAllowed(String identifier);

    /**
     * Checks and records in one step.
     *
     * @return the instant the slot was recorded at, empty if the window is full
     */
    Optional<Instant> tryAcquire(String identifier);

    /**
     * Gives back a slot taken by {@link #tryAcquire} whose send did not go out.
     */
    void release(String identifier, Instant acquiredAt);

    /**
     * @return sends left in the current window, never negative
     */
    int remaining(String identifier);

    /**
     * @return seconds until the oldest recorded send leaves the window, 0 if a send fits now
     */
    long getRetryAfterSeconds(String identifier);

    void reset(String identifier);

    /**
     * Drops identifiers with no sends left in the window.
     */
    void cleanup();
}
