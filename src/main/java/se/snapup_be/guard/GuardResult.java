package se.snapup_be.guard;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GuardResult {

    private GuardVerdict verdict;

    // which rule fired, null when clean
    private GuardRule rule;

    // what was detected, for logs and moderation
    private String details;

    // shown to the sender
    private String userMessage;

    private int remainingQuota;

    private Long retryAfterSeconds;

    // true when a WARN was let through because the sender chose to override it
    private boolean overridden;

    // quota slot held by MessageGuard.reserve, given back if the send fails
    @JsonIgnore
    private Instant reservedAt;

    public static GuardResult clean() {
        return GuardResult.builder().verdict(GuardVerdict.ALLOW).build();
    }

    public static GuardResult block(String details, String userMessage) {
        return GuardResult.builder()
                .verdict(GuardVerdict.BLOCK)
                .rule(GuardRule.BLOCKED_CONTENT)
                .details(details)
                .userMessage(userMessage)
                .build();
    }

    public static GuardResult warn(String details, String userMessage) {
        return GuardResult.builder()
                .verdict(GuardVerdict.WARN)
                .rule(GuardRule.SUSPICIOUS_PATTERN)
                .details(details)
                .userMessage(userMessage)
                .build();
    }

    public boolean isSendable() {
        return verdict == GuardVerdict.ALLOW || (verdict == GuardVerdict.WARN && overridden);
    }
}
