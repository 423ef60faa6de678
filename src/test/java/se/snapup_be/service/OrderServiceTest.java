package se.snapup_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.dto.response.TrackingResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.OfferDecision;
import se.snapup_be.pojo.enums.OfferStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.UserRepository;
import se.snapup_be.support.MarketplaceFixtures;
import se.snapup_be.support.MutableClock;
import se.snapup_be.support.TestClockConfiguration;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@DisplayName("OrderService Integration Tests")
class OrderServiceTest {

    @Autowired
    private OrderService orderService;

    @Autowired
    private OfferService offerService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ListingRepository listingRepository;

    @Autowired
    private MutableClock clock;

    private MarketplaceFixtures fixtures;
    private User buyer;
    private User seller;
    private Listing listing;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfiguration.START);
        fixtures = new MarketplaceFixtures(userRepository, listingRepository, clock);
        buyer = fixtures.user("buyer");
        seller = fixtures.user("seller");
        listing = fixtures.listing(seller, 100000L);
    }

    private Long acceptedOrder(User offerBuyer, long amount) {
        OfferResponse offer = offerService.proposeOffer(listing.getListingId(), offerBuyer.getUserId(),
                seller.getUserId(), amount, null, false);
        return offerService.respondToOffer(offer.getOfferId(), seller.getUserId(), OfferDecision.ACCEPT, OfferStatus.PENDING)
                .getOrder().getOrderId();
    }

    private ListingStatus listingStatus() {
        return listingRepository.findById(listing.getListingId()).orElseThrow().getStatus();
    }

    @Test
    @DisplayName("Payment marks the listing sold; repeating it with the same reference is a no-op")
    void markPaidIsIdempotent() {
        Long orderId = acceptedOrder(buyer, 80000L);

        OrderResponse paid = orderService.markPaid(orderId, "PAY-1");
        clock.advance(Duration.ofMinutes(1));
        OrderResponse again = orderService.markPaid(orderId, "PAY-1");

        assertThat(paid.getStatus()).isEqualTo(OrderStatus.PAID);
        assertThat(again.getPaidAt()).isEqualTo(paid.getPaidAt());
        assertThat(listingStatus()).isEqualTo(ListingStatus.SOLD);
        assertThatThrownBy(() -> orderService.markPaid(orderId, "PAY-2"))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Only the seller can ship, and only once paid")
    void shipping() {
        Long orderId = acceptedOrder(buyer, 80000L);

        assertThatThrownBy(() -> orderService.markShipped(orderId, seller.getUserId(), "TRK-1", "PostNet"))
                .isInstanceOf(InvalidStateTransitionException.class);

        orderService.markPaid(orderId, "PAY-1");
        assertThatThrownBy(() -> orderService.markShipped(orderId, buyer.getUserId(), "TRK-1", "PostNet"))
                .isInstanceOf(UnauthorizedException.class);

        OrderResponse shipped = orderService.markShipped(orderId, seller.getUserId(), "TRK-1", "PostNet");
        assertThat(shipped.getStatus()).isEqualTo(OrderStatus.SHIPPED);
        assertThat(shipped.getTrackingStatus()).isEqualTo(TrackingStatus.SHIPPED);
    }

    @Test
    @DisplayName("Courier updates change the tracking status but not the order status")
    void trackingUpdate() {
        Long orderId = acceptedOrder(buyer, 80000L);
        orderService.markPaid(orderId, "PAY-1");
        orderService.markShipped(orderId, seller.getUserId(), "TRK-1", "PostNet");

        orderService.addTrackingUpdate(orderId, null, true, TrackingStatus.IN_TRANSIT, "At the hub");

        OrderResponse order = orderService.getOrder(orderId, buyer.getUserId());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.SHIPPED);
        assertThat(order.getTrackingStatus()).isEqualTo(TrackingStatus.IN_TRANSIT);
        assertThatThrownBy(() -> orderService.addTrackingUpdate(orderId, seller.getUserId(), false,
                TrackingStatus.DELIVERED, null))
                .isInstanceOf(BusinessLogicException.class);
    }

    @Test
    @DisplayName("Unpaid orders expire after the payment window and the listing goes back on sale")
    void paymentExpiry() {
        Long orderId = acceptedOrder(buyer, 80000L);
        assertThat(orderService.findExpiredPendingOrderIds()).doesNotContain(orderId);

        clock.advance(Duration.ofMinutes(31));
        assertThat(orderService.findExpiredPendingOrderIds()).contains(orderId);
        assertThat(orderService.expirePendingOrder(orderId)).isTrue();
        assertThat(orderService.expirePendingOrder(orderId)).isFalse();

        List<TrackingResponse> history = orderService.getTrackingHistory(orderId, buyer.getUserId());
        assertThat(history).extracting(TrackingResponse::getStatus)
                .containsExactly(TrackingStatus.PENDING, TrackingStatus.CANCELLED);
        assertThat(orderService.getOrder(orderId, seller.getUserId()).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(listingStatus()).isEqualTo(ListingStatus.ACTIVE);
    }

    @Test
    @DisplayName("Accepting a second buyer's offer cancels the first unpaid order on the listing")
    void latestAcceptedDealWins() {
        User otherBuyer = fixtures.user("buyer");
        OfferResponse first = offerService.proposeOffer(listing.getListingId(), buyer.getUserId(),
                seller.getUserId(), 80000L, null, false);
        OfferResponse second = offerService.proposeOffer(listing.getListingId(), otherBuyer.getUserId(),
                seller.getUserId(), 85000L, null, false);

        Long firstOrderId = offerService.respondToOffer(first.getOfferId(), seller.getUserId(),
                OfferDecision.ACCEPT, OfferStatus.PENDING).getOrder().getOrderId();
        Long secondOrderId = offerService.respondToOffer(second.getOfferId(), seller.getUserId(),
                OfferDecision.ACCEPT, OfferStatus.PENDING).getOrder().getOrderId();

        assertThat(orderService.getOrder(firstOrderId, buyer.getUserId()).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(orderService.getOrder(secondOrderId, otherBuyer.getUserId()).getStatus())
                .isEqualTo(OrderStatus.PENDING_PAYMENT);
    }

    @Test
    @DisplayName("A second buyer's pending offer cannot be accepted once the item has sold")
    void soldListingCannotBeSoldAgain() {
        User otherBuyer = fixtures.user("buyer");
        OfferResponse first = offerService.proposeOffer(listing.getListingId(), buyer.getUserId(),
                seller.getUserId(), 80000L, null, false);
        OfferResponse second = offerService.proposeOffer(listing.getListingId(), otherBuyer.getUserId(),
                seller.getUserId(), 85000L, null, false);
        Long firstOrderId = offerService.respondToOffer(first.getOfferId(), seller.getUserId(),
                OfferDecision.ACCEPT, OfferStatus.PENDING).getOrder().getOrderId();
        orderService.markPaid(firstOrderId, "PAY-1");
        assertThat(listingStatus()).isEqualTo(ListingStatus.SOLD);

        assertThatThrownBy(() -> offerService.respondToOffer(second.getOfferId(), seller.getUserId(),
                OfferDecision.ACCEPT, OfferStatus.PENDING))
                .isInstanceOfSatisfying(InvalidStateTransitionException.class,
                        e -> assertThat(e.getCurrentStatus()).isEqualTo("SOLD"));

        assertThat(listingStatus()).isEqualTo(ListingStatus.SOLD);
        assertThat(offerService.getOffer(second.getOfferId(), otherBuyer.getUserId()).getStatus())
                .isEqualTo(OfferStatus.PENDING);
        assertThat(orderService.getUserOrders(otherBuyer.getUserId(), "buyer")).isEmpty();
        assertThat(orderService.getOrder(firstOrderId, buyer.getUserId()).getStatus()).isEqualTo(OrderStatus.PAID);
    }

    @Test
    @DisplayName("Payment is rejected when the listing is no longer awaiting payment")
    void paymentRequiresPendingListing() {
        Long orderId = acceptedOrder(buyer, 80000L);
        Listing withdrawn = listingRepository.findById(listing.getListingId()).orElseThrow();
        withdrawn.setStatus(ListingStatus.INACTIVE);
        listingRepository.save(withdrawn);

        assertThatThrownBy(() -> orderService.markPaid(orderId, "PAY-1"))
                .isInstanceOf(InvalidStateTransitionException.class);

        assertThat(orderService.getOrder(orderId, buyer.getUserId()).getStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
        assertThat(listingStatus()).isEqualTo(ListingStatus.INACTIVE);
    }

    @Test
    @DisplayName("Outsiders cannot read an order")
    void outsiderCannotRead() {
        Long orderId = acceptedOrder(buyer, 80000L);
        User stranger = fixtures.user("stranger");

        assertThatThrownBy(() -> orderService.getOrder(orderId, stranger.getUserId()))
                .isInstanceOf(UnauthorizedException.class);
    }
}
