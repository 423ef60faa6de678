package se.snapup_be.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes committed changes to each party's {@code /user/queue/changes}. Best effort:
 * a client that misses a push recovers through a snapshot resync.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChangeEventRelay {

    public static final String CHANGES_QUEUE = "/queue/changes";

    private final SimpMessageSendingOperations messagingTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void relay(EntityChangedEvent event) {
        ChangeEvent change = event.getChange();
        for (String username : event.getRecipients()) {
            try {
                messagingTemplate.convertAndSendToUser(username, CHANGES_QUEUE, change);
            } catch (Exception e) {
                log.warn("Failed to push {} {} {} to {}: {}", change.getChangeType(), change.getEntityType(),
                        change.getEntityId(), username, e.getMessage());
            }
        }
    }
}
