package se.snapup_be.guard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Advisory gate in front of outbound chat: sliding-window rate limit first, then
 * content classification. Never suspends accounts or persists anything.
 */
@Component
@Slf4j
public class MessageGuard {

    private final RateLimiter rateLimiter;
    private final ContentClassifier classifier;
    private final int maxMessages;

    public MessageGuard(ContentClassifier classifier,
                        Clock clock,
                        @Value("${snapup.guard.max-messages:5}") int maxMessages,
                        @Value("${snapup.guard.window:PT60S}") Duration window) {
        this.classifier = classifier;
        this.maxMessages = maxMessages;
        this.rateLimiter = new SlidingWindowRateLimiter(maxMessages, window, clock);
    }

    public GuardResult check(Long senderId, String content, boolean overrideWarning) {
        if (content == null || content.isBlank()) {
            return GuardResult.clean().toBuilder().remainingQuota(remaining(senderId)).build();
        }

        String key = String.valueOf(senderId);
        if (!rateLimiter.isAllowed(key)) {
            return rateLimited(senderId, key);
        }

        GuardResult result = classifier.classify(content);
        if (result.getVerdict() != GuardVerdict.ALLOW) {
            log.debug("Message from {} classified {}: {}", senderId, result.getVerdict(), result.getDetails());
        }
        return result.toBuilder()
                .remainingQuota(rateLimiter.remaining(key))
                .overridden(result.getVerdict() == GuardVerdict.WARN && overrideWarning)
                .build();
    }

    /**
     * Like {@link #check} but takes the quota slot in the same step, so concurrent sends
     * from one sender cannot overrun the limit. The slot is kept only when the result is
     * sendable; the caller gives it back with {@link #cancelReservation} if the send fails.
     */
    public GuardResult reserve(Long senderId, String content, boolean overrideWarning) {
        String key = String.valueOf(senderId);
        Optional<Instant> slot = rateLimiter.tryAcquire(key);
        if (slot.isEmpty()) {
            return rateLimited(senderId, key);
        }

        GuardResult result = classifier.classify(content);
        boolean overridden = result.getVerdict() == GuardVerdict.WARN && overrideWarning;
        if (result.getVerdict() == GuardVerdict.BLOCK || (result.getVerdict() == GuardVerdict.WARN && !overridden)) {
            rateLimiter.release(key, slot.get());
            log.debug("Message from {} classified {}: {}", senderId, result.getVerdict(), result.getDetails());
            return result.toBuilder().remainingQuota(rateLimiter.remaining(key)).build();
        }
        return result.toBuilder()
                .remainingQuota(rateLimiter.remaining(key))
                .overridden(overridden)
                .reservedAt(slot.get())
                .build();
    }

    public void cancelReservation(Long senderId, GuardResult reservation) {
        if (reservation.getReservedAt() != null) {
            rateLimiter.release(String.valueOf(senderId), reservation.getReservedAt());
        }
    }

    public int remaining(Long senderId) {
        return rateLimiter.remaining(String.valueOf(senderId));
    }

    private GuardResult rateLimited(Long senderId, String key) {
        long retryAfter = rateLimiter.getRetryAfterSeconds(key);
        log.debug("Sender {} rate limited, retry after {}s", senderId, retryAfter);
        return GuardResult.builder()
                .verdict(GuardVerdict.RATE_LIMITED)
                .rule(GuardRule.RATE_LIMIT)
                .details(maxMessages + "/" + maxMessages + " messages in window")
                .userMessage("You're sending messages too quickly. Please wait " + retryAfter
                        + (retryAfter == 1 ? " second" : " seconds") + " before sending another message.")
                .remainingQuota(0)
                .retryAfterSeconds(retryAfter)
                .build();
    }

    @Scheduled(fixedDelayString = "${snapup.guard.cleanup-interval-ms:300000}")
    public void evictStaleWindows() {
        rateLimiter.cleanup();
    }
}
