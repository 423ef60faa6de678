package se.snapup_be.sync;

import lombok.Getter;

import java.util.Set;

/**
 * Published inside the writing transaction; relayed to clients only after commit.
 */
@Getter
public class EntityChangedEvent {

    private final ChangeEvent change;
    private final Set<String> recipients;

    public EntityChangedEvent(ChangeEvent change, Set<String> recipients) {
        this.change = change;
        this.recipients = Set.copyOf(recipients);
    }
}
