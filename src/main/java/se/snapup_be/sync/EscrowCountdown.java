package se.snapup_be.sync;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

/**
 * Advisory time left on a hold, as shown to the user. The server decides the release.
 */
@Data
@AllArgsConstructor
public class EscrowCountdown {
    private Long orderId;
    private Duration remaining;
    private boolean due;
}
