package se.snapup_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.Offer;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.OfferStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.OfferRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.sync.ChangePublisher;
import se.snapup_be.sync.ChangeType;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an accepted offer into exactly one order. Runs inside the accepting transaction,
 * so the offer status change and the order insert commit or roll back together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderMaterializationService {

    private static final Set<ListingStatus> CLAIMABLE = EnumSet.of(ListingStatus.ACTIVE, ListingStatus.PENDING_PAYMENT);

    private final OfferRepository offerRepository;
    private final OrderRepository orderRepository;
    private final TrackingService trackingService;
    private final ListingRepository listingRepository;
    private final CommissionSchedule commissionSchedule;
    private final ChangePublisher changePublisher;
    private final Clock clock;

    /**
     * Creates the order for an ACCEPTED offer, or returns the one that already exists.
     * A concurrent insert surfaces as a unique violation on {@code offer_id} and rolls the
     * caller's transaction back; the caller then reads the winner's order. A listing that is
     * already SOLD or withdrawn fails the accept with {@link InvalidStateTransitionException}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MaterializationResult materialize(Long offerId) {
        Optional<Order> existing = orderRepository.findByOfferOfferId(offerId);
        if (existing.isPresent()) {
            log.info("Offer {} already materialized as order {}", offerId, existing.get().getOrderId());
            return new MaterializationResult(existing.get(), true);
        }

        Offer offer = offerRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
        if (offer.getStatus() != OfferStatus.ACCEPTED) {
            throw new IllegalStateException("Offer " + offerId + " is " + offer.getStatus() + ", not ACCEPTED");
        }

        Instant now = clock.instant();
        long agreed = offer.getAgreedAmount();
        FeeBreakdown fee = commissionSchedule.computeFee(agreed);

        Order order = Order.builder()
                .offer(offer)
                .listing(offer.getListing())
                .buyer(offer.getBuyer())
                .seller(offer.getSeller())
                .amount(agreed)
                .serviceFee(fee.getFee())
                .total(agreed + fee.getFee())
                .status(OrderStatus.PENDING_PAYMENT)
                .trackingStatus(TrackingStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        order = orderRepository.saveAndFlush(order);
        Long orderId = order.getOrderId();
        Long listingId = offer.getListing().getListingId();

        trackingService.record(order, TrackingStatus.PENDING, "system",
                "Order created from accepted offer, awaiting payment");

        if (listingRepository.claimStatus(listingId, CLAIMABLE, ListingStatus.PENDING_PAYMENT, now) == 0) {
            ListingStatus listingStatus = listingRepository.findById(listingId)
                    .map(Listing::getStatus)
                    .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
            log.info("Offer {} cannot be accepted, listing {} is {}", offerId, listingId, listingStatus);
            throw new InvalidStateTransitionException(listingStatus.name(), "accept offer on listing");
        }
        List<Long> cancelled = cancelStalePendingOrders(listingId, orderId, now);

        // bulk updates above cleared the persistence context
        order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        changePublisher.orderChanged(order, ChangeType.INSERT);
        for (Long cancelledId : cancelled) {
            orderRepository.findById(cancelledId)
                    .ifPresent(stale -> changePublisher.orderChanged(stale, ChangeType.UPDATE));
        }

        log.info("Materialized offer {} into order {}: amount {}, fee {} ({} tier), total {}",
                offerId, orderId, agreed, fee.getFee(), fee.getTier(), order.getTotal());
        return new MaterializationResult(order, false);
    }

    /**
     * Cancels every other order on the listing still waiting for payment. Only one
     * accepted deal per listing can proceed to payment.
     */
    private List<Long> cancelStalePendingOrders(Long listingId, Long keepOrderId, Instant now) {
        List<Long> stale = orderRepository.findStalePendingOrders(listingId, keepOrderId).stream()
                .map(Order::getOrderId)
                .toList();
        for (Long staleId : stale) {
            if (orderRepository.cancelPending(staleId, now) == 1) {
                log.info("Cancelled stale pending order {} on listing {}", staleId, listingId);
            }
        }
        return stale;
    }
}
