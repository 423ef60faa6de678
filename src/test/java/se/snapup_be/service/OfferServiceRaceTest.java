package se.snapup_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.RespondOfferResponse;
import se.snapup_be.exception.StaleOfferStateException;
import se.snapup_be.guard.ContentClassifier;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.Offer;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.OfferDecision;
import se.snapup_be.pojo.enums.OfferStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.OfferRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.repository.UserRepository;
import se.snapup_be.sync.ChangePublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Commands whose conditional write finds the offer already moved on by a concurrent
 * command, between the read and the write of the same transaction.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OfferService Race Unit Tests")
class OfferServiceRaceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final Long OFFER_ID = 10L;

    @Mock
    private OfferRepository offerRepository;

    @Mock
    private ListingRepository listingRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderMaterializationService materializationService;

    @Mock
    private ChatService chatService;

    @Mock
    private ChangePublisher changePublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private OfferService service;
    private User buyer;
    private User seller;
    private Listing listing;

    @BeforeEach
    void setUp() {
        service = new OfferService(offerRepository, listingRepository, userRepository, orderRepository,
                new OfferStateMachine(), materializationService, chatService, new ContentClassifier(),
                changePublisher, transactionManager, Clock.fixed(NOW, ZoneOffset.UTC));
        buyer = User.builder().userId(1L).username("thandi").build();
        seller = User.builder().userId(2L).username("sipho").build();
        listing = Listing.builder().listingId(7L).title("Denim jacket").price(100000L).seller(seller).build();
    }

    private Offer offer(OfferStatus status) {
        return Offer.builder()
                .offerId(OFFER_ID)
                .listing(listing)
                .buyer(buyer)
                .seller(seller)
                .amount(80000L)
                .status(status)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @Test
    @DisplayName("Accept whose write lands after a withdraw fails with the withdrawn offer and creates no order")
    void acceptLosesAtWrite() {
        when(offerRepository.findById(OFFER_ID))
                .thenReturn(Optional.of(offer(OfferStatus.PENDING)), Optional.of(offer(OfferStatus.WITHDRAWN)));
        when(offerRepository.close(OFFER_ID, OfferStatus.PENDING, OfferStatus.ACCEPTED, NOW)).thenReturn(0);

        assertThatThrownBy(() -> service.respondToOffer(OFFER_ID, seller.getUserId(), OfferDecision.ACCEPT, OfferStatus.PENDING))
                .isInstanceOfSatisfying(StaleOfferStateException.class, e ->
                        assertThat(((OfferResponse) e.getCurrent()).getStatus()).isEqualTo(OfferStatus.WITHDRAWN));

        verify(materializationService, never()).materialize(anyLong());
        verify(chatService, never()).sendOfferNotice(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Accept whose write lands after another accept returns the existing order")
    void acceptLosesToAccept() {
        Offer accepted = offer(OfferStatus.ACCEPTED);
        Order existing = Order.builder()
                .orderId(99L)
                .offer(accepted)
                .listing(listing)
                .buyer(buyer)
                .seller(seller)
                .amount(80000L)
                .serviceFee(8000L)
                .total(88000L)
                .status(OrderStatus.PENDING_PAYMENT)
                .build();
        when(offerRepository.findById(OFFER_ID))
                .thenReturn(Optional.of(offer(OfferStatus.PENDING)), Optional.of(accepted));
        when(offerRepository.close(OFFER_ID, OfferStatus.PENDING, OfferStatus.ACCEPTED, NOW)).thenReturn(0);
        when(orderRepository.findByOfferOfferId(OFFER_ID)).thenReturn(Optional.of(existing));

        RespondOfferResponse result = service.respondToOffer(OFFER_ID, seller.getUserId(), OfferDecision.ACCEPT, null);

        assertThat(result.isAlreadyMaterialized()).isTrue();
        assertThat(result.getOrder().getOrderId()).isEqualTo(99L);
        verify(materializationService, never()).materialize(anyLong());
        verify(chatService, never()).sendOfferNotice(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Withdraw whose write lands after an accept fails with the accepted offer")
    void withdrawLosesAtWrite() {
        when(offerRepository.findById(OFFER_ID))
                .thenReturn(Optional.of(offer(OfferStatus.PENDING)), Optional.of(offer(OfferStatus.ACCEPTED)));
        when(offerRepository.close(OFFER_ID, OfferStatus.PENDING, OfferStatus.WITHDRAWN, NOW)).thenReturn(0);

        assertThatThrownBy(() -> service.withdrawOffer(OFFER_ID, buyer.getUserId(), OfferStatus.PENDING))
                .isInstanceOfSatisfying(StaleOfferStateException.class, e ->
                        assertThat(((OfferResponse) e.getCurrent()).getStatus()).isEqualTo(OfferStatus.ACCEPTED));

        verify(chatService, never()).sendOfferNotice(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Counter whose write lands after a withdraw fails with the withdrawn offer")
    void counterLosesAtWrite() {
        when(offerRepository.findById(OFFER_ID))
                .thenReturn(Optional.of(offer(OfferStatus.PENDING)), Optional.of(offer(OfferStatus.WITHDRAWN)));
        when(offerRepository.counter(OFFER_ID, 90000L, NOW)).thenReturn(0);

        assertThatThrownBy(() -> service.counterOffer(OFFER_ID, seller.getUserId(), 90000L, OfferStatus.PENDING))
                .isInstanceOfSatisfying(StaleOfferStateException.class, e ->
                        assertThat(((OfferResponse) e.getCurrent()).getStatus()).isEqualTo(OfferStatus.WITHDRAWN));
    }
}
