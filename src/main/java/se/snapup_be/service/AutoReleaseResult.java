package se.snapup_be.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import se.snapup_be.dto.response.EscrowHoldResponse;

@Getter
@AllArgsConstructor
public class AutoReleaseResult {
    private final EscrowHoldResponse hold;
    private final ReleaseDecision decision;
    // true only for the call that moved the hold to RELEASED
    private final boolean released;
}
