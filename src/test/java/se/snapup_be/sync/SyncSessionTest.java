package se.snapup_be.sync;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import se.snapup_be.dto.response.EscrowHoldResponse;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.SyncSnapshotResponse;
import se.snapup_be.pojo.enums.EscrowStatus;
import se.snapup_be.pojo.enums.OfferStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SyncSession Unit Tests")
class SyncSessionTest {

    private static final Long BUYER = 1L;
    private static final Long SELLER = 2L;
    private static final Long LISTING = 10L;
    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final AtomicReference<SyncSnapshotResponse> serverState = new AtomicReference<>();
    private final AtomicInteger verifications = new AtomicInteger();
    private final AtomicReference<ChangeEvent> verifierAnswer = new AtomicReference<>();
    private SyncSession session;

    @BeforeEach
    void setUp() throws Exception {
        serverState.set(SyncSnapshotResponse.builder().userId(BUYER).takenAt(T0).build());
        session = new SyncSession(BUYER,
                (userId, listingId, counterpartyId) -> serverState.get(),
                orderId -> {
                    verifications.incrementAndGet();
                    return verifierAnswer.get();
                });
        await(session.openThread(LISTING, SELLER));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("Newer version replaces the local copy")
    void newerVersionApplies() throws Exception {
        assertThat(await(session.onEvent(offer(100L, OfferStatus.PENDING, T0)))).isEqualTo(MergeOutcome.APPLIED);
        assertThat(await(session.onEvent(offer(100L, OfferStatus.COUNTERED, T0.plusSeconds(5)))))
                .isEqualTo(MergeOutcome.APPLIED);

        assertThat(await(session.entry(EntityType.OFFER, 100L)).getStatus()).isEqualTo("COUNTERED");
    }

    @Test
    @DisplayName("Duplicate delivery is discarded")
    void duplicateIsDiscarded() throws Exception {
        ChangeEvent event = offer(100L, OfferStatus.PENDING, T0);
        await(session.onEvent(event));

        assertThat(await(session.onEvent(event))).isEqualTo(MergeOutcome.DUPLICATE);
        assertThat(await(session.entries(EntityType.OFFER))).hasSize(1);
    }

    @Test
    @DisplayName("Out-of-order delivery never rolls the view back")
    void outOfOrderIsDiscarded() throws Exception {
        await(session.onEvent(offer(100L, OfferStatus.ACCEPTED, T0.plusSeconds(10))));

        assertThat(await(session.onEvent(offer(100L, OfferStatus.COUNTERED, T0.plusSeconds(5)))))
                .isEqualTo(MergeOutcome.STALE);
        assertThat(await(session.entry(EntityType.OFFER, 100L)).getStatus()).isEqualTo("ACCEPTED");
    }

    @Test
    @DisplayName("Same timestamp with a less advanced status is stale")
    void equalTimestampLowerRankIsStale() throws Exception {
        await(session.onEvent(offer(100L, OfferStatus.COUNTERED, T0)));

        assertThat(await(session.onEvent(offer(100L, OfferStatus.PENDING, T0)))).isEqualTo(MergeOutcome.STALE);
        assertThat(await(session.onEvent(offer(100L, OfferStatus.ACCEPTED, T0)))).isEqualTo(MergeOutcome.APPLIED);
    }

    @Test
    @DisplayName("Offers of other threads and rows of other users are out of scope")
    void scopeFiltering() throws Exception {
        ChangeEvent otherListing = offer(101L, OfferStatus.PENDING, T0).toBuilder().listingId(99L).build();
        ChangeEvent otherUsers = offer(102L, OfferStatus.PENDING, T0).toBuilder().buyerId(5L).sellerId(6L).build();

        assertThat(await(session.onEvent(otherListing))).isEqualTo(MergeOutcome.OUT_OF_SCOPE);
        assertThat(await(session.onEvent(otherUsers))).isEqualTo(MergeOutcome.OUT_OF_SCOPE);
        assertThat(await(session.onEvent(hold(300L, 30L, EscrowStatus.PENDING, T0, T0.plus(Duration.ofHours(48))))))
                .isEqualTo(MergeOutcome.APPLIED);
    }

    @Test
    @DisplayName("Reconnect replaces the view with the server snapshot")
    void reconnectReplacesView() throws Exception {
        await(session.onEvent(offer(100L, OfferStatus.PENDING, T0)));

        // while disconnected the offer was countered and a second, stale row disappeared server side
        serverState.set(SyncSnapshotResponse.builder()
                .userId(BUYER)
                .takenAt(T0.plusSeconds(60))
                .offers(new ArrayList<>(List.of(offerResponse(100L, OfferStatus.COUNTERED, T0.plusSeconds(30)))))
                .build());
        await(session.reconnect());

        List<ChangeEvent> offers = await(session.entries(EntityType.OFFER));
        assertThat(offers).hasSize(1);
        assertThat(offers.get(0).getStatus()).isEqualTo("COUNTERED");
    }

    @Test
    @DisplayName("Failed snapshot keeps the current view")
    void failedReconnectKeepsView() throws Exception {
        SyncSession flaky = new SyncSession(BUYER,
                (userId, listingId, counterpartyId) -> {
                    throw new IllegalStateException("offline");
                },
                orderId -> null);
        try {
            await(flaky.onEvent(hold(300L, 30L, EscrowStatus.PENDING, T0, T0.plusSeconds(60))));

            assertThat(flaky.reconnect()).failsWithin(5, TimeUnit.SECONDS);
            assertThat(await(flaky.entries(EntityType.ESCROW_HOLD))).hasSize(1);
        } finally {
            flaky.close();
        }
    }

    @Test
    @DisplayName("Countdown is advisory and asks the server once when it runs out")
    void tickVerifiesOnceWhenDue() throws Exception {
        Instant releaseAt = T0.plus(Duration.ofHours(48));
        await(session.onEvent(hold(300L, 30L, EscrowStatus.PENDING, T0, releaseAt)));
        verifierAnswer.set(hold(300L, 30L, EscrowStatus.RELEASED, releaseAt.plusSeconds(1), releaseAt));

        List<EscrowCountdown> early = await(session.tick(releaseAt.minusSeconds(120)));
        assertThat(early).singleElement().satisfies(c -> {
            assertThat(c.isDue()).isFalse();
            assertThat(c.getRemaining()).isEqualTo(Duration.ofSeconds(120));
        });
        assertThat(verifications.get()).isZero();

        List<EscrowCountdown> due = await(session.tick(releaseAt));
        assertThat(due).singleElement().satisfies(c -> assertThat(c.isDue()).isTrue());
        await(session.verification(30L));
        assertThat(verifications.get()).isEqualTo(1);
        assertThat(await(session.entry(EntityType.ESCROW_HOLD, 300L)).getStatus()).isEqualTo("RELEASED");

        // released holds have no countdown and are not verified again
        assertThat(await(session.tick(releaseAt.plusSeconds(5)))).isEmpty();
        assertThat(verifications.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("A hold the server still holds is verified again on a later tick")
    void stillPendingIsRetried() throws Exception {
        Instant releaseAt = T0.plus(Duration.ofHours(48));
        ChangeEvent pending = hold(300L, 30L, EscrowStatus.PENDING, T0, releaseAt);
        await(session.onEvent(pending));
        verifierAnswer.set(pending);

        await(session.tick(releaseAt));
        assertThat(await(session.verification(30L)).getStatus()).isEqualTo("PENDING");
        await(session.tick(releaseAt.plusSeconds(1)));
        await(session.verification(30L));

        assertThat(verifications.get()).isEqualTo(2);
        assertThat(await(session.entry(EntityType.ESCROW_HOLD, 300L)).getStatus()).isEqualTo("PENDING");
    }

    @Test
    @DisplayName("A slow release check does not hold up events or ticks")
    void slowVerificationDoesNotBlockSession() throws Exception {
        CountDownLatch serverAnswering = new CountDownLatch(1);
        CountDownLatch letServerAnswer = new CountDownLatch(1);
        Instant releaseAt = T0.plus(Duration.ofHours(48));
        SyncSession slow = new SyncSession(BUYER,
                (userId, listingId, counterpartyId) -> serverState.get(),
                orderId -> {
                    serverAnswering.countDown();
                    try {
                        letServerAnswer.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    return hold(300L, 30L, EscrowStatus.RELEASED, releaseAt.plusSeconds(1), releaseAt);
                });
        try {
            await(slow.openThread(LISTING, SELLER));
            await(slow.onEvent(hold(300L, 30L, EscrowStatus.PENDING, T0, releaseAt)));

            await(slow.tick(releaseAt));
            assertThat(serverAnswering.await(5, TimeUnit.SECONDS)).isTrue();

            // the verifier is still waiting on the server
            assertThat(await(slow.onEvent(offer(100L, OfferStatus.PENDING, T0)))).isEqualTo(MergeOutcome.APPLIED);
            assertThat(await(slow.tick(releaseAt.plusSeconds(1)))).singleElement()
                    .satisfies(c -> assertThat(c.isDue()).isTrue());
            assertThat(await(slow.entry(EntityType.ESCROW_HOLD, 300L)).getStatus()).isEqualTo("PENDING");

            letServerAnswer.countDown();
            await(slow.verification(30L));
            assertThat(await(slow.entry(EntityType.ESCROW_HOLD, 300L)).getStatus()).isEqualTo("RELEASED");
        } finally {
            letServerAnswer.countDown();
            slow.close();
        }
    }

    @Test
    @DisplayName("A failed release check is retried on a later tick")
    void failedVerificationIsRetried() throws Exception {
        Instant releaseAt = T0.plus(Duration.ofHours(48));
        AtomicInteger attempts = new AtomicInteger();
        SyncSession flaky = new SyncSession(BUYER,
                (userId, listingId, counterpartyId) -> serverState.get(),
                orderId -> {
                    if (attempts.incrementAndGet() == 1) {
                        throw new IllegalStateException("server unavailable");
                    }
                    return hold(300L, 30L, EscrowStatus.RELEASED, releaseAt.plusSeconds(1), releaseAt);
                });
        try {
            await(flaky.onEvent(hold(300L, 30L, EscrowStatus.PENDING, T0, releaseAt)));

            await(flaky.tick(releaseAt));
            assertThat(await(flaky.verification(30L))).isNull();
            await(flaky.tick(releaseAt.plusSeconds(1)));
            await(flaky.verification(30L));

            assertThat(attempts.get()).isEqualTo(2);
            assertThat(await(flaky.entry(EntityType.ESCROW_HOLD, 300L)).getStatus()).isEqualTo("RELEASED");
        } finally {
            flaky.close();
        }
    }

    private static <T> T await(java.util.concurrent.CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static OfferResponse offerResponse(Long offerId, OfferStatus status, Instant updatedAt) {
        return OfferResponse.builder()
                .offerId(offerId)
                .listingId(LISTING)
                .buyerId(BUYER)
                .sellerId(SELLER)
                .amount(90000L)
                .status(status)
                .createdAt(T0)
                .updatedAt(updatedAt)
                .build();
    }

    private static ChangeEvent offer(Long offerId, OfferStatus status, Instant updatedAt) {
        return ChangeEvent.offer(offerResponse(offerId, status, updatedAt), ChangeType.UPDATE);
    }

    private static ChangeEvent hold(Long holdId, Long orderId, EscrowStatus status, Instant updatedAt, Instant releaseAt) {
        return ChangeEvent.hold(EscrowHoldResponse.builder()
                .holdId(holdId)
                .orderId(orderId)
                .listingId(LISTING)
                .buyerId(BUYER)
                .sellerId(SELLER)
                .amount(90000L)
                .status(status)
                .releaseAt(releaseAt)
                .updatedAt(updatedAt)
                .build(), ChangeType.UPDATE);
    }
}
