package se.snapup_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.dto.response.RespondOfferResponse;
import se.snapup_be.exception.ContentBlockedException;
import se.snapup_be.exception.ContentWarnedException;
import se.snapup_be.exception.DuplicateActiveOfferException;
import se.snapup_be.exception.InvalidAmountException;
import se.snapup_be.exception.InvalidCounterException;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.StaleOfferStateException;
import se.snapup_be.guard.GuardVerdict;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.OfferDecision;
import se.snapup_be.pojo.enums.OfferStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.repository.UserRepository;
import se.snapup_be.support.MarketplaceFixtures;
import se.snapup_be.support.MutableClock;
import se.snapup_be.support.TestClockConfiguration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@DisplayName("OfferService Integration Tests")
class OfferServiceTest {

    @Autowired
    private OfferService offerService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ListingRepository listingRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private MutableClock clock;

    private User buyer;
    private User seller;
    private Listing listing;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfiguration.START);
        MarketplaceFixtures fixtures = new MarketplaceFixtures(userRepository, listingRepository, clock);
        buyer = fixtures.user("buyer");
        seller = fixtures.user("seller");
        listing = fixtures.listing(seller, 100000L);
    }

    private OfferResponse propose(long amount) {
        return offerService.proposeOffer(listing.getListingId(), buyer.getUserId(), seller.getUserId(), amount, null, false);
    }

    @Test
    @DisplayName("Propose, counter, accept yields one order at the countered price with the tiered fee")
    void negotiateToOrder() {
        OfferResponse offer = propose(80000L);
        offerService.counterOffer(offer.getOfferId(), seller.getUserId(), 90000L, OfferStatus.PENDING);

        RespondOfferResponse result = offerService.respondToOffer(
                offer.getOfferId(), buyer.getUserId(), OfferDecision.ACCEPT, OfferStatus.COUNTERED);

        OrderResponse order = result.getOrder();
        assertThat(result.getOffer().getStatus()).isEqualTo(OfferStatus.ACCEPTED);
        assertThat(result.isAlreadyMaterialized()).isFalse();
        assertThat(order.getAmount()).isEqualTo(90000L);
        assertThat(order.getServiceFee()).isEqualTo(9000L);
        assertThat(order.getTotal()).isEqualTo(99000L);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
        assertThat(orderRepository.findByBuyerUserIdOrderByCreatedAtDesc(buyer.getUserId())).hasSize(1);
        assertThat(listingRepository.findById(listing.getListingId()).orElseThrow().getStatus())
                .isEqualTo(ListingStatus.PENDING_PAYMENT);
    }

    @Test
    @DisplayName("Accepting twice materializes exactly one order")
    void acceptIsIdempotent() {
        OfferResponse offer = propose(70000L);

        RespondOfferResponse first = offerService.respondToOffer(
                offer.getOfferId(), seller.getUserId(), OfferDecision.ACCEPT, OfferStatus.PENDING);
        RespondOfferResponse retry = offerService.respondToOffer(
                offer.getOfferId(), seller.getUserId(), OfferDecision.ACCEPT, OfferStatus.PENDING);

        assertThat(retry.isAlreadyMaterialized()).isTrue();
        assertThat(retry.getOrder().getOrderId()).isEqualTo(first.getOrder().getOrderId());
        assertThat(orderRepository.findByBuyerUserIdOrderByCreatedAtDesc(buyer.getUserId())).hasSize(1);
    }

    @Test
    @DisplayName("A second propose on the same thread is rejected while the first is active")
    void singleActiveOffer() {
        OfferResponse first = propose(80000L);

        assertThatThrownBy(() -> propose(85000L))
                .isInstanceOf(DuplicateActiveOfferException.class);

        offerService.withdrawOffer(first.getOfferId(), buyer.getUserId(), OfferStatus.PENDING);
        OfferResponse second = propose(85000L);
        assertThat(second.getStatus()).isEqualTo(OfferStatus.PENDING);
    }

    @Test
    @DisplayName("Offer amount must be below the listing price")
    void proposeRejectsFullPrice() {
        assertThatThrownBy(() -> propose(100000L))
                .isInstanceOf(InvalidAmountException.class);
    }

    @Test
    @DisplayName("An offer message with contact details is blocked and no offer is created")
    void proposeBlocksContactDetails() {
        assertThatThrownBy(() -> offerService.proposeOffer(listing.getListingId(), buyer.getUserId(),
                seller.getUserId(), 80000L, "Call me on 082 555 1234", false))
                .isInstanceOfSatisfying(ContentBlockedException.class,
                        e -> assertThat(e.getGuardResult().getVerdict()).isEqualTo(GuardVerdict.BLOCK));

        assertThat(offerService.getOffersForListing(listing.getListingId(), seller.getUserId())).isEmpty();
        assertThat(propose(80000L).getStatus()).isEqualTo(OfferStatus.PENDING);
    }

    @Test
    @DisplayName("A warned offer message goes through only when the buyer overrides the warning")
    void proposeWarnNeedsOverride() {
        String message = "Happy to pay upfront if you hold it for me";

        assertThatThrownBy(() -> offerService.proposeOffer(listing.getListingId(), buyer.getUserId(),
                seller.getUserId(), 80000L, message, false))
                .isInstanceOf(ContentWarnedException.class);

        OfferResponse offer = offerService.proposeOffer(listing.getListingId(), buyer.getUserId(),
                seller.getUserId(), 80000L, message, true);
        assertThat(offer.getMessage()).isEqualTo(message);
    }

    @Nested
    @DisplayName("Counter")
    class Counter {

        @Test
        @DisplayName("Counter at or below the offer amount is rejected and leaves the offer unchanged")
        void counterMustExceedOffer() {
            OfferResponse offer = propose(80000L);

            assertThatThrownBy(() -> offerService.counterOffer(offer.getOfferId(), seller.getUserId(), 80000L, null))
                    .isInstanceOf(InvalidCounterException.class);

            OfferResponse current = offerService.getOffer(offer.getOfferId(), buyer.getUserId());
            assertThat(current.getStatus()).isEqualTo(OfferStatus.PENDING);
            assertThat(current.getCounterAmount()).isNull();
        }

        @Test
        @DisplayName("Counter above the listing price is rejected")
        void counterCappedAtListingPrice() {
            OfferResponse offer = propose(80000L);

            assertThatThrownBy(() -> offerService.counterOffer(offer.getOfferId(), seller.getUserId(), 100001L, null))
                    .isInstanceOf(InvalidCounterException.class);
        }

        @Test
        @DisplayName("Second counter on a countered offer is a state-transition error; the first counter stays")
        void secondCounterRejected() {
            OfferResponse offer = propose(80000L);
            offerService.counterOffer(offer.getOfferId(), seller.getUserId(), 90000L, OfferStatus.PENDING);

            assertThatThrownBy(() -> offerService.counterOffer(offer.getOfferId(), seller.getUserId(), 95000L, null))
                    .isInstanceOf(InvalidStateTransitionException.class);

            OfferResponse current = offerService.getOffer(offer.getOfferId(), seller.getUserId());
            assertThat(current.getStatus()).isEqualTo(OfferStatus.COUNTERED);
            assertThat(current.getCounterAmount()).isEqualTo(90000L);
        }
    }

    @Test
    @DisplayName("Accept after the buyer withdrew loses with the current state attached")
    void acceptLosesToWithdraw() {
        OfferResponse offer = propose(80000L);
        offerService.withdrawOffer(offer.getOfferId(), buyer.getUserId(), OfferStatus.PENDING);

        assertThatThrownBy(() -> offerService.respondToOffer(
                offer.getOfferId(), seller.getUserId(), OfferDecision.ACCEPT, OfferStatus.PENDING))
                .isInstanceOfSatisfying(StaleOfferStateException.class, e -> {
                    assertThat(e.getCurrent()).isInstanceOf(OfferResponse.class);
                    assertThat(((OfferResponse) e.getCurrent()).getStatus()).isEqualTo(OfferStatus.WITHDRAWN);
                });
        assertThat(orderRepository.findByOfferOfferId(offer.getOfferId())).isEmpty();
    }

    @Test
    @DisplayName("Withdraw after the seller accepted loses; the order stands")
    void withdrawLosesToAccept() {
        OfferResponse offer = propose(80000L);
        offerService.respondToOffer(offer.getOfferId(), seller.getUserId(), OfferDecision.ACCEPT, OfferStatus.PENDING);

        assertThatThrownBy(() -> offerService.withdrawOffer(offer.getOfferId(), buyer.getUserId(), null))
                .isInstanceOf(StaleOfferStateException.class);
        assertThat(orderRepository.findByOfferOfferId(offer.getOfferId())).isPresent();
    }
}
