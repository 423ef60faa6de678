package se.snapup_be.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import se.snapup_be.dto.response.EscrowHoldResponse;

@Getter
@AllArgsConstructor
public class HoldResult {
    private final EscrowHoldResponse hold;
    // the order already had a hold; nothing was created
    private final boolean alreadyHeld;
}
