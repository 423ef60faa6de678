package se.snapup_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.snapup_be.dto.response.DisputeResponse;
import se.snapup_be.dto.response.EscrowHoldResponse;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.dto.response.SyncSnapshotResponse;
import se.snapup_be.pojo.Offer;
import se.snapup_be.repository.DisputeRepository;
import se.snapup_be.repository.EscrowHoldRepository;
import se.snapup_be.repository.OfferRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.sync.ChangeEvent;
import se.snapup_be.sync.ChangeType;
import se.snapup_be.sync.ReleaseVerifier;
import se.snapup_be.sync.SnapshotSource;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Full state snapshots for reconnecting clients, and the server side of countdown
 * verification.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncSnapshotService implements SnapshotSource, ReleaseVerifier {

    private final OfferRepository offerRepository;
    private final OrderRepository orderRepository;
    private final EscrowHoldRepository escrowHoldRepository;
    private final DisputeRepository disputeRepository;
    private final EscrowService escrowService;
    private final Clock clock;

    /**
     * Everything the user is party to. With a listing and counterparty the offers are
     * narrowed to that one negotiation thread, in either direction.
     */
    @Transactional(readOnly = true)
    public SyncSnapshotResponse snapshot(Long userId, Long listingId, Long counterpartyId) {
        List<Offer> offers;
        if (listingId != null && counterpartyId != null) {
            offers = new ArrayList<>(offerRepository.findConversationOffers(listingId, userId, counterpartyId));
            offers.addAll(offerRepository.findConversationOffers(listingId, counterpartyId, userId));
            offers.sort(Comparator.comparing(Offer::getCreatedAt).reversed());
        } else {
            offers = offerRepository.findByParticipant(userId);
        }

        SyncSnapshotResponse snapshot = SyncSnapshotResponse.builder()
                .userId(userId)
                .takenAt(clock.instant())
                .offers(offers.stream().map(OfferResponse::fromEntity).collect(Collectors.toList()))
                .orders(orderRepository.findByParticipant(userId).stream()
                        .map(OrderResponse::fromEntity).collect(Collectors.toList()))
                .holds(escrowHoldRepository.findByParticipant(userId).stream()
                        .map(EscrowHoldResponse::fromEntity).collect(Collectors.toList()))
                .disputes(disputeRepository.findByParticipant(userId).stream()
                        .map(DisputeResponse::fromEntity).collect(Collectors.toList()))
                .build();

        log.debug("Snapshot for user {}: {} offers, {} orders, {} holds, {} disputes", userId,
                snapshot.getOffers().size(), snapshot.getOrders().size(),
                snapshot.getHolds().size(), snapshot.getDisputes().size());
        return snapshot;
    }

    @Override
    @Transactional(readOnly = true)
    public SyncSnapshotResponse fetch(Long userId, Long listingId, Long counterpartyId) {
        return snapshot(userId, listingId, counterpartyId);
    }

    @Override
    public ChangeEvent verifyRelease(Long orderId) {
        AutoReleaseResult result = escrowService.autoRelease(orderId);
        return ChangeEvent.hold(result.getHold(), ChangeType.UPDATE);
    }
}
