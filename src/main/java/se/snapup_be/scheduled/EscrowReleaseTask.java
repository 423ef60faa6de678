package se.snapup_be.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.snapup_be.service.AutoReleaseResult;
import se.snapup_be.service.EscrowService;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Releases due holds and creates holds missing for delivered orders. Each row runs in
 * its own transaction; a failure is logged and the row is picked up again next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowReleaseTask {

    private final EscrowService escrowService;

    @Scheduled(fixedDelayString = "${snapup.escrow.sweep-interval-ms:60000}",
               initialDelayString = "${snapup.escrow.sweep-initial-delay-ms:30000}")
    public void sweep() {
        repairMissingHolds();
        releaseDueHolds();
    }

    void releaseDueHolds() {
        List<Long> due = escrowService.findOrderIdsDueForRelease();
        if (due.isEmpty()) {
            return;
        }
        log.info("Found {} escrow holds due for release", due.size());

        int released = 0;
        for (Long orderId : due) {
            try {
                AutoReleaseResult result = escrowService.autoRelease(orderId);
                if (result.isReleased()) {
                    released++;
                }
            } catch (Exception e) {
                log.error("Auto-release failed for order {}: {}", orderId, e.getMessage(), e);
            }
        }
        log.info("Escrow sweep released {} of {} due holds", released, due.size());
    }

    void repairMissingHolds() {
        Map<Long, Instant> missing = escrowService.findDeliveredOrdersWithoutHold();
        if (missing.isEmpty()) {
            return;
        }
        log.warn("Found {} delivered orders without an escrow hold", missing.size());
        missing.forEach(escrowService::repairMissingHold);
    }
}
