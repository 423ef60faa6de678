package se.snapup_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.dto.response.RespondOfferResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.ContentBlockedException;
import se.snapup_be.exception.ContentWarnedException;
import se.snapup_be.exception.DuplicateActiveOfferException;
import se.snapup_be.exception.InvalidAmountException;
import se.snapup_be.exception.InvalidCounterException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.exception.StaleOfferStateException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.exception.UpstreamUnavailableException;
import se.snapup_be.guard.ContentClassifier;
import se.snapup_be.guard.GuardResult;
import se.snapup_be.guard.GuardVerdict;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.Offer;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.OfferAction;
import se.snapup_be.pojo.enums.OfferDecision;
import se.snapup_be.pojo.enums.OfferParty;
import se.snapup_be.pojo.enums.OfferStatus;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.OfferRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.repository.UserRepository;
import se.snapup_be.sync.ChangePublisher;
import se.snapup_be.sync.ChangeType;
import se.snapup_be.util.MoneyUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Offer negotiation between one buyer and one seller on one listing.
 *
 * <p>Every write is a conditional update on the status read at the start of the
 * command. Losing a race yields {@link StaleOfferStateException} with the winner's state.
 * Chat notices go out after commit and never fail the command.
 */
@Service
@Slf4j
public class OfferService {

    private final OfferRepository offerRepository;
    private final ListingRepository listingRepository;
    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final OfferStateMachine stateMachine;
    private final OrderMaterializationService materializationService;
    private final ChatService chatService;
    private final ContentClassifier contentClassifier;
    private final ChangePublisher changePublisher;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;

    public OfferService(OfferRepository offerRepository,
                        ListingRepository listingRepository,
                        UserRepository userRepository,
                        OrderRepository orderRepository,
                        OfferStateMachine stateMachine,
                        OrderMaterializationService materializationService,
                        ChatService chatService,
                        ContentClassifier contentClassifier,
                        ChangePublisher changePublisher,
                        PlatformTransactionManager transactionManager,
                        Clock clock) {
        this.offerRepository = offerRepository;
        this.listingRepository = listingRepository;
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.stateMachine = stateMachine;
        this.materializationService = materializationService;
        this.chatService = chatService;
        this.contentClassifier = contentClassifier;
        this.changePublisher = changePublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
    }

    /**
     * Opens a negotiation. The optional message goes to the seller with the offer, so it is
     * classified like chat: blocked content fails the call and a warning needs
     * {@code overrideWarning}.
     */
    public OfferResponse proposeOffer(Long listingId, Long buyerId, Long sellerId, long amount,
                                      String message, boolean overrideWarning) {
        GuardResult guard = contentClassifier.classify(message);
        if (guard.getVerdict() == GuardVerdict.BLOCK) {
            log.info("Offer message from buyer {} on listing {} blocked: {}", buyerId, listingId, guard.getDetails());
            throw new ContentBlockedException(guard);
        }
        if (guard.getVerdict() == GuardVerdict.WARN) {
            if (!overrideWarning) {
                throw new ContentWarnedException(guard);
            }
            log.info("Buyer {} overrode content warning on offer message: {}", buyerId, guard.getDetails());
        }

        String threadKey = Offer.threadKey(listingId, buyerId, sellerId);
        OfferResponse created;
        try {
            created = inTransaction(status -> {
                Listing listing = listingRepository.findById(listingId)
                        .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
                if (listing.getStatus() != ListingStatus.ACTIVE) {
                    throw new BusinessLogicException("Listing is not accepting offers (status " + listing.getStatus() + ")");
                }
                if (!listing.getSeller().getUserId().equals(sellerId)) {
                    throw new BusinessLogicException("Seller " + sellerId + " does not own listing " + listingId);
                }
                if (buyerId.equals(sellerId)) {
                    throw new BusinessLogicException("You cannot make an offer on your own listing");
                }
                if (amount <= 0 || amount >= listing.getPrice()) {
                    throw new InvalidAmountException(amount, listing.getPrice());
                }
                offerRepository.findByActiveKey(threadKey).ifPresent(active -> {
                    throw new DuplicateActiveOfferException(active.getOfferId());
                });

                User buyer = userRepository.findById(buyerId)
                        .orElseThrow(() -> new ResourceNotFoundException("User", buyerId));
                Instant now = clock.instant();
                Offer offer = offerRepository.saveAndFlush(Offer.builder()
                        .listing(listing)
                        .buyer(buyer)
                        .seller(listing.getSeller())
                        .amount(amount)
                        .message(message)
                        .status(OfferStatus.PENDING)
                        .activeKey(threadKey)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
                changePublisher.offerChanged(offer, ChangeType.INSERT);
                return OfferResponse.fromEntity(offer);
            });
        } catch (DataIntegrityViolationException e) {
            // lost the race against another propose on the same thread
            Long existingId = readOnlyTemplate.execute(status ->
                    offerRepository.findByActiveKey(threadKey).map(Offer::getOfferId).orElse(null));
            log.info("Concurrent propose on thread {} rejected, active offer {}", threadKey, existingId);
            throw new DuplicateActiveOfferException(existingId);
        }

        log.info("Offer {} proposed on listing {} by buyer {}: {}", created.getOfferId(), listingId, buyerId, amount);
        String notice = "Made an offer of " + MoneyUtils.format(amount)
                + (message != null && !message.isBlank() ? ": " + message : "");
        chatService.sendOfferNotice(listingId, buyerId, sellerId, notice);
        return created;
    }

    public OfferResponse counterOffer(Long offerId, Long sellerId, long counterAmount, OfferStatus expectedStatus) {
        OfferResponse countered = inTransaction(status -> {
            Offer offer = loadOffer(offerId);
            checkExpectedStatus(offer, expectedStatus);
            transition(offer, OfferAction.COUNTER, sellerId);

            long listingPrice = offer.getListing().getPrice();
            if (counterAmount <= offer.getAmount() || counterAmount > listingPrice) {
                throw new InvalidCounterException(counterAmount, offer.getAmount(), listingPrice);
            }
            if (offerRepository.counter(offerId, counterAmount, clock.instant()) == 0) {
                throw stale(offerId);
            }
            Offer updated = loadOffer(offerId);
            changePublisher.offerChanged(updated, ChangeType.UPDATE);
            return OfferResponse.fromEntity(updated);
        });

        log.info("Offer {} countered by seller {} at {}", offerId, sellerId, counterAmount);
        chatService.sendOfferNotice(countered.getListingId(), sellerId, countered.getBuyerId(),
                "Countered with " + MoneyUtils.format(counterAmount));
        return countered;
    }

    public RespondOfferResponse respondToOffer(Long offerId, Long actorId, OfferDecision decision, OfferStatus expectedStatus) {
        RespondOfferResponse result;
        try {
            result = inTransaction(status -> {
                Offer offer = loadOffer(offerId);
                if (decision == OfferDecision.ACCEPT && offer.getStatus() == OfferStatus.ACCEPTED) {
                    requireParty(offer, actorId);
                    return alreadyAccepted(offer);
                }
                checkExpectedStatus(offer, expectedStatus);
                OfferAction action = decision == OfferDecision.ACCEPT ? OfferAction.ACCEPT : OfferAction.DECLINE;
                OfferStatus target = transition(offer, action, actorId);

                if (offerRepository.close(offerId, offer.getStatus(), target, clock.instant()) == 0) {
                    Offer current = loadOffer(offerId);
                    if (decision == OfferDecision.ACCEPT && current.getStatus() == OfferStatus.ACCEPTED) {
                        return alreadyAccepted(current);
                    }
                    throw new StaleOfferStateException("Offer changed to " + current.getStatus() + " before your response",
                            OfferResponse.fromEntity(current));
                }

                Offer updated = loadOffer(offerId);
                changePublisher.offerChanged(updated, ChangeType.UPDATE);
                OfferResponse offerResponse = OfferResponse.fromEntity(updated);
                if (target != OfferStatus.ACCEPTED) {
                    return RespondOfferResponse.builder().offer(offerResponse).build();
                }

                MaterializationResult materialized = materializationService.materialize(offerId);
                return RespondOfferResponse.builder()
                        .offer(offerResponse)
                        .order(OrderResponse.fromEntity(materialized.getOrder()))
                        .alreadyMaterialized(materialized.isAlreadyMaterialized())
                        .build();
            });
        } catch (DataIntegrityViolationException e) {
            if (decision != OfferDecision.ACCEPT) {
                throw e;
            }
            // another accept created the order first
            result = readOnlyTemplate.execute(status -> alreadyAccepted(loadOffer(offerId)));
            log.info("Concurrent accept on offer {} resolved to existing order", offerId);
        }

        if (result.isAlreadyMaterialized()) {
            return result;
        }

        OfferResponse offer = result.getOffer();
        Long counterpartyId = actorId.equals(offer.getBuyerId()) ? offer.getSellerId() : offer.getBuyerId();
        if (decision == OfferDecision.ACCEPT) {
            log.info("Offer {} accepted by {}, order {}", offerId, actorId, result.getOrder().getOrderId());
            chatService.sendOfferNotice(offer.getListingId(), actorId, counterpartyId,
                    "Accepted the offer of " + MoneyUtils.format(offer.getAgreedAmount())
                            + ". Order #" + result.getOrder().getOrderId() + " is awaiting payment.");
        } else {
            log.info("Offer {} declined by {}", offerId, actorId);
            chatService.sendOfferNotice(offer.getListingId(), actorId, counterpartyId, "Declined the offer");
        }
        return result;
    }

    public OfferResponse withdrawOffer(Long offerId, Long buyerId, OfferStatus expectedStatus) {
        OfferResponse withdrawn = inTransaction(status -> {
            Offer offer = loadOffer(offerId);
            checkExpectedStatus(offer, expectedStatus);
            OfferStatus target = transition(offer, OfferAction.WITHDRAW, buyerId);
            if (offerRepository.close(offerId, offer.getStatus(), target, clock.instant()) == 0) {
                throw stale(offerId);
            }
            Offer updated = loadOffer(offerId);
            changePublisher.offerChanged(updated, ChangeType.UPDATE);
            return OfferResponse.fromEntity(updated);
        });

        log.info("Offer {} withdrawn by buyer {}", offerId, buyerId);
        chatService.sendOfferNotice(withdrawn.getListingId(), buyerId, withdrawn.getSellerId(), "Withdrew the offer");
        return withdrawn;
    }

    @Transactional(readOnly = true)
    public List<OfferResponse> getOffersForConversation(Long listingId, Long buyerId, Long sellerId) {
        return offerRepository.findConversationOffers(listingId, buyerId, sellerId).stream()
                .map(OfferResponse::fromEntity)
                .collect(Collectors.toList());
    }

    /**
     * The seller sees every offer on the listing; anyone else sees only their own.
     */
    @Transactional(readOnly = true)
    public List<OfferResponse> getOffersForListing(Long listingId, Long userId) {
        Listing listing = listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
        boolean isSeller = listing.getSeller().getUserId().equals(userId);
        return offerRepository.findByListingListingIdOrderByCreatedAtDesc(listingId).stream()
                .filter(offer -> isSeller || offer.isBuyer(userId))
                .map(OfferResponse::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public OfferResponse getOffer(Long offerId, Long userId) {
        Offer offer = loadOffer(offerId);
        requireParty(offer, userId);
        return OfferResponse.fromEntity(offer);
    }

    private OfferStatus transition(Offer offer, OfferAction action, Long actorId) {
        try {
            return stateMachine.next(offer.getStatus(), action, partyOf(offer, actorId));
        } catch (StaleOfferStateException e) {
            throw new StaleOfferStateException(e.getMessage(), OfferResponse.fromEntity(offer));
        }
    }

    private RespondOfferResponse alreadyAccepted(Offer offer) {
        return orderRepository.findByOfferOfferId(offer.getOfferId())
                .map(order -> RespondOfferResponse.builder()
                        .offer(OfferResponse.fromEntity(offer))
                        .order(OrderResponse.fromEntity(order))
                        .alreadyMaterialized(true)
                        .build())
                .orElseGet(() -> {
                    // accepted but the order is missing: create it now
                    MaterializationResult materialized = materializationService.materialize(offer.getOfferId());
                    return RespondOfferResponse.builder()
                            .offer(OfferResponse.fromEntity(loadOffer(offer.getOfferId())))
                            .order(OrderResponse.fromEntity(materialized.getOrder()))
                            .alreadyMaterialized(true)
                            .build();
                });
    }

    private void checkExpectedStatus(Offer offer, OfferStatus expectedStatus) {
        if (expectedStatus != null && expectedStatus != offer.getStatus()) {
            throw new StaleOfferStateException(
                    "Offer is " + offer.getStatus() + ", expected " + expectedStatus,
                    OfferResponse.fromEntity(offer));
        }
    }

    private void requireParty(Offer offer, Long userId) {
        if (partyOf(offer, userId) == OfferParty.NONE) {
            throw new UnauthorizedException("You are not a party to this offer");
        }
    }

    private OfferParty partyOf(Offer offer, Long userId) {
        if (offer.isBuyer(userId)) {
            return OfferParty.BUYER;
        }
        if (offer.isSeller(userId)) {
            return OfferParty.SELLER;
        }
        return OfferParty.NONE;
    }

    private StaleOfferStateException stale(Long offerId) {
        Offer current = loadOffer(offerId);
        return new StaleOfferStateException("Offer changed to " + current.getStatus() + " before your update landed",
                OfferResponse.fromEntity(current));
    }

    private Offer loadOffer(Long offerId) {
        return offerRepository.findById(offerId)
                .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
    }

    private <T> T inTransaction(TransactionCallback<T> callback) {
        try {
            return transactionTemplate.execute(callback);
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            throw new UpstreamUnavailableException("Offer store temporarily unavailable, refresh and retry", e);
        }
    }
}
