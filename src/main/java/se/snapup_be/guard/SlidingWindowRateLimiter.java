package se.snapup_be.guard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window limiter keeping the timestamps of recent sends per identifier.
 *
 * A send recorded at {@code t} counts against the quota while {@code now - t < window}.
 * Thread-safe: the map is concurrent and each window deque is guarded by its own monitor.
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private final int maxEvents;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int maxEvents, Duration window, Clock clock) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("Max events must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.maxEvents = maxEvents;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public boolean isAllowed(String identifier) {
        return remaining(identifier) > 0;
    }

    @Override
    public Optional<Instant> tryAcquire(String identifier) {
        Instant now = clock.instant();
        Deque<Instant> events = windows.computeIfAbsent(identifier, k -> new ArrayDeque<>());
        synchronized (events) {
            prune(events, now);
            if (events.size() >= maxEvents) {
                return Optional.empty();
            }
            events.addLast(now);
            return Optional.of(now);
        }
    }

    @Override
    public void release(String identifier, Instant acquiredAt) {
        Deque<Instant> events = windows.get(identifier);
        if (events == null) {
            return;
        }
        synchronized (events) {
            events.removeLastOccurrence(acquiredAt);
        }
    }

    @Override
    public int remaining(String identifier) {
        Deque<Instant> events = windows.get(identifier);
        if (events == null) {
            return maxEvents;
        }
        synchronized (events) {
            prune(events, clock.instant());
            return Math.max(0, maxEvents - events.size());
        }
    }

    @Override
    public long getRetryAfterSeconds(String identifier) {
        Deque<Instant> events = windows.get(identifier);
        if (events == null) {
            return 0;
        }
        Instant now = clock.instant();
        synchronized (events) {
            prune(events, now);
            if (events.size() < maxEvents) {
                return 0;
            }
            long elapsedMillis = Duration.between(events.peekFirst(), now).toMillis();
            long waitMillis = window.toMillis() - elapsedMillis;
            return (long) Math.ceil(waitMillis / 1000.0);
        }
    }

    @Override
    public void reset(String identifier) {
        windows.remove(identifier);
    }

    @Override
    public void cleanup() {
        Instant now = clock.instant();
        windows.entrySet().removeIf(entry -> {
            Deque<Instant> events = entry.getValue();
            synchronized (events) {
                prune(events, now);
                return events.isEmpty();
            }
        });
    }

    int trackedIdentifiers() {
        return windows.size();
    }

    private void prune(Deque<Instant> events, Instant now) {
        while (!events.isEmpty() && Duration.between(events.peekFirst(), now).compareTo(window) >= 0) {
            events.pollFirst();
        }
    }
}
