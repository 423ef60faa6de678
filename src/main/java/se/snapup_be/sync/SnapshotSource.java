package se.snapup_be.sync;

import se.snapup_be.dto.response.SyncSnapshotResponse;

/**
 * Server-side snapshot fetch as seen by a {@link SyncSession}.
 */
@FunctionalInterface
public interface SnapshotSource {

    SyncSnapshotResponse fetch(Long userId, Long listingId, Long counterpartyId);
}
