package se.snapup_be.sync;

import lombok.extern.slf4j.Slf4j;
import se.snapup_be.dto.response.SyncSnapshotResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client-side view of one user's negotiation state.
 *
 * <p>All inputs (pushed change events, commands, timer ticks) go through a single
 * mailbox thread, so the view is never touched concurrently. Every entry is replaced
 * wholesale by a newer version; older, duplicate and out-of-scope events are dropped.
 * After a reconnect the view is rebuilt from a full snapshot, never from replayed pushes.
 *
 * <p>Escrow countdowns are advisory. When one reaches zero the session asks the server
 * to verify the release on a separate thread and merges whatever state comes back through
 * the mailbox, so a slow server never holds up events or ticks.
 */
@Slf4j
public class SyncSession implements AutoCloseable {

    private static final AtomicInteger SESSION_IDS = new AtomicInteger();

    private final Long userId;
    private final SnapshotSource snapshotSource;
    private final ReleaseVerifier releaseVerifier;
    private final ExecutorService mailbox;
    private final ExecutorService verifier;

    // mailbox thread only
    private final Map<String, ChangeEvent> view = new LinkedHashMap<>();
    private final Map<Long, CompletableFuture<ChangeEvent>> verificationsInFlight = new HashMap<>();
    private Long activeListingId;
    private Long activeCounterpartyId;

    public SyncSession(Long userId, SnapshotSource snapshotSource, ReleaseVerifier releaseVerifier) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.snapshotSource = Objects.requireNonNull(snapshotSource, "snapshotSource");
        this.releaseVerifier = Objects.requireNonNull(releaseVerifier, "releaseVerifier");
        int id = SESSION_IDS.incrementAndGet();
        this.mailbox = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "sync-session-" + id);
            thread.setDaemon(true);
            return thread;
        });
        this.verifier = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "sync-verify-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Focuses the session on one negotiation thread and loads it from a fresh snapshot.
     */
    public CompletableFuture<Void> openThread(Long listingId, Long counterpartyId) {
        return submit(() -> {
            activeListingId = listingId;
            activeCounterpartyId = counterpartyId;
            replaceView(snapshotSource.fetch(userId, listingId, counterpartyId));
            return null;
        });
    }

    /**
     * Rebuilds the view from a full snapshot. The current view stays visible until the
     * snapshot arrives and is kept if the fetch fails.
     */
    public CompletableFuture<Void> reconnect() {
        return submit(() -> {
            replaceView(snapshotSource.fetch(userId, activeListingId, activeCounterpartyId));
            return null;
        });
    }

    public CompletableFuture<MergeOutcome> onEvent(ChangeEvent event) {
        return submit(() -> merge(event));
    }

    /**
     * Refreshes countdowns for every pending hold in view. Holds whose countdown has run
     * out are sent to the server for verification once per expiry.
     */
    public CompletableFuture<List<EscrowCountdown>> tick(Instant now) {
        return submit(() -> {
            List<EscrowCountdown> countdowns = new ArrayList<>();
            for (ChangeEvent hold : snapshotOf(EntityType.ESCROW_HOLD)) {
                if (!"PENDING".equals(hold.getStatus()) || hold.getReleaseAt() == null) {
                    continue;
                }
                Duration remaining = Duration.between(now, hold.getReleaseAt());
                boolean due = !now.isBefore(hold.getReleaseAt());
                countdowns.add(new EscrowCountdown(hold.getOrderId(), due ? Duration.ZERO : remaining, due));
                if (due) {
                    verify(hold.getOrderId());
                }
            }
            return countdowns;
        });
    }

    /**
     * Runs an arbitrary command on the mailbox thread, ordered with events and ticks.
     */
    public <T> CompletableFuture<T> submit(Callable<T> command) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            mailbox.execute(() -> {
                try {
                    result.complete(command.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Completes once the release verification running for the order has been merged into
     * the view, with the state the server returned. Completes with null when none is running.
     */
    public CompletableFuture<ChangeEvent> verification(Long orderId) {
        return submit(() -> verificationsInFlight.get(orderId))
                .thenCompose(inFlight -> inFlight != null ? inFlight : CompletableFuture.completedFuture(null));
    }

    public CompletableFuture<List<ChangeEvent>> entries(EntityType type) {
        return submit(() -> snapshotOf(type));
    }

    public CompletableFuture<ChangeEvent> entry(EntityType type, Long entityId) {
        return submit(() -> view.get(key(type, entityId)));
    }

    @Override
    public void close() {
        verifier.shutdownNow();
        mailbox.shutdownNow();
    }

    private MergeOutcome merge(ChangeEvent incoming) {
        if (!inScope(incoming)) {
            return MergeOutcome.OUT_OF_SCOPE;
        }
        String key = key(incoming.getEntityType(), incoming.getEntityId());
        ChangeEvent current = view.get(key);
        if (current == null) {
            view.put(key, incoming);
            return MergeOutcome.APPLIED;
        }

        int byTime = compareUpdatedAt(incoming.getUpdatedAt(), current.getUpdatedAt());
        if (byTime < 0) {
            return MergeOutcome.STALE;
        }
        if (byTime == 0) {
            if (Objects.equals(incoming.getStatus(), current.getStatus())) {
                return MergeOutcome.DUPLICATE;
            }
            int incomingRank = StatusRank.of(incoming.getEntityType(), incoming.getStatus());
            int currentRank = StatusRank.of(current.getEntityType(), current.getStatus());
            if (incomingRank < currentRank) {
                return MergeOutcome.STALE;
            }
        }
        view.put(key, incoming);
        if (incoming.getEntityType() == EntityType.ESCROW_HOLD && !"PENDING".equals(incoming.getStatus())) {
            verificationsInFlight.remove(incoming.getOrderId());
        }
        return MergeOutcome.APPLIED;
    }

    private boolean inScope(ChangeEvent event) {
        if (event == null || event.getEntityType() == null || event.getEntityId() == null) {
            return false;
        }
        if (!event.involves(userId)) {
            return false;
        }
        if (event.getEntityType() != EntityType.OFFER) {
            return true;
        }
        if (activeListingId == null || !activeListingId.equals(event.getListingId())) {
            return false;
        }
        if (activeCounterpartyId == null) {
            return true;
        }
        Long counterparty = userId.equals(event.getBuyerId()) ? event.getSellerId() : event.getBuyerId();
        return activeCounterpartyId.equals(counterparty);
    }

    private void replaceView(SyncSnapshotResponse snapshot) {
        Map<String, ChangeEvent> fresh = new LinkedHashMap<>();
        List<ChangeEvent> incoming = new ArrayList<>();
        snapshot.getOffers().forEach(o -> incoming.add(ChangeEvent.offer(o, ChangeType.UPDATE)));
        snapshot.getOrders().forEach(o -> incoming.add(ChangeEvent.order(o, ChangeType.UPDATE)));
        snapshot.getHolds().forEach(h -> incoming.add(ChangeEvent.hold(h, ChangeType.UPDATE)));
        snapshot.getDisputes().forEach(d -> incoming.add(ChangeEvent.dispute(d, ChangeType.UPDATE)));
        for (ChangeEvent event : incoming) {
            if (inScope(event)) {
                fresh.put(key(event.getEntityType(), event.getEntityId()), event);
            }
        }
        view.clear();
        view.putAll(fresh);
        verificationsInFlight.clear();
        log.debug("Session for user {} rebuilt from snapshot with {} entries", userId, view.size());
    }

    private void verify(Long orderId) {
        if (orderId == null || verificationsInFlight.containsKey(orderId)) {
            return;
        }
        CompletableFuture<ChangeEvent> merged = new CompletableFuture<>();
        verificationsInFlight.put(orderId, merged);
        CompletableFuture.supplyAsync(() -> releaseVerifier.verifyRelease(orderId), verifier)
                .whenComplete((current, error) -> submit(() -> {
                    applyVerification(orderId, current, error);
                    merged.complete(current);
                    return null;
                }));
    }

    private void applyVerification(Long orderId, ChangeEvent current, Throwable error) {
        if (error != null) {
            verificationsInFlight.remove(orderId);
            log.warn("Release verification for order {} failed: {}", orderId, error.getMessage());
            return;
        }
        if (current != null) {
            merge(current);
        }
        if (current == null || "PENDING".equals(current.getStatus())) {
            // still held, ask again on a later tick
            verificationsInFlight.remove(orderId);
        }
    }

    private List<ChangeEvent> snapshotOf(EntityType type) {
        List<ChangeEvent> result = new ArrayList<>();
        Collection<ChangeEvent> values = view.values();
        for (ChangeEvent event : values) {
            if (event.getEntityType() == type) {
                result.add(event);
            }
        }
        return result;
    }

    private static int compareUpdatedAt(Instant a, Instant b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static String key(EntityType type, Long id) {
        return type.name() + ":" + id;
    }
}
