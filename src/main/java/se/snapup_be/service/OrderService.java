package se.snapup_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.dto.response.TrackingResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.sync.ChangePublisher;
import se.snapup_be.sync.ChangeType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Order lifecycle after materialization: payment, shipping, tracking and cancellation.
 * Delivery is confirmed by the buyer through {@link DeliveryConfirmationService}.
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class OrderService {

    private static final Set<TrackingStatus> COURIER_STATUSES = EnumSet.of(
            TrackingStatus.PROCESSING, TrackingStatus.IN_TRANSIT, TrackingStatus.OUT_FOR_DELIVERY,
            TrackingStatus.RETURNED);

    private final OrderRepository orderRepository;
    private final ListingRepository listingRepository;
    private final TrackingService trackingService;
    private final ChangePublisher changePublisher;
    private final Clock clock;
    private final Duration paymentWindow;

    public OrderService(OrderRepository orderRepository,
                        ListingRepository listingRepository,
                        TrackingService trackingService,
                        ChangePublisher changePublisher,
                        Clock clock,
                        @Value("${snapup.orders.payment-window:PT30M}") Duration paymentWindow) {
        this.orderRepository = orderRepository;
        this.listingRepository = listingRepository;
        this.trackingService = trackingService;
        this.changePublisher = changePublisher;
        this.clock = clock;
        this.paymentWindow = paymentWindow;
    }

    /**
     * Payment confirmation hook. Repeating the call with the same reference is a no-op.
     * The listing moves PENDING_PAYMENT to SOLD in the same transaction; if it is not
     * PENDING_PAYMENT the payment is rejected and the order stays unpaid.
     */
    @Transactional
    public OrderResponse markPaid(Long orderId, String paymentReference) {
        Instant now = clock.instant();
        if (orderRepository.markPaid(orderId, paymentReference, now) == 0) {
            Order current = loadOrder(orderId);
            if (current.getStatus() == OrderStatus.PAID && paymentReference.equals(current.getPaymentReference())) {
                return OrderResponse.fromEntity(current);
            }
            throw new InvalidStateTransitionException(current.getStatus().name(), "mark paid");
        }

        Order order = loadOrder(orderId);
        Long listingId = order.getListing().getListingId();
        if (listingRepository.compareAndSetStatus(listingId, ListingStatus.PENDING_PAYMENT, ListingStatus.SOLD, now) == 0) {
            ListingStatus listingStatus = listingRepository.findById(listingId)
                    .map(Listing::getStatus)
                    .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
            log.warn("Payment {} for order {} rejected, listing {} is {}", paymentReference, orderId, listingId, listingStatus);
            throw new InvalidStateTransitionException(listingStatus.name(), "mark paid on listing");
        }
        order = loadOrder(orderId);
        trackingService.record(order, TrackingStatus.PROCESSING, "system", "Payment received: " + paymentReference);
        changePublisher.orderChanged(order, ChangeType.UPDATE);

        log.info("Order {} paid, reference {}", orderId, paymentReference);
        return OrderResponse.fromEntity(order);
    }

    @Transactional
    public OrderResponse markShipped(Long orderId, Long sellerId, String trackingNumber, String carrier) {
        Order order = loadOrder(orderId);
        if (!order.isSeller(sellerId)) {
            throw new UnauthorizedException("Only the seller can ship this order");
        }
        if (orderRepository.markShipped(orderId, trackingNumber, carrier, clock.instant()) == 0) {
            throw new InvalidStateTransitionException(loadOrder(orderId).getStatus().name(), "ship");
        }

        order = loadOrder(orderId);
        trackingService.record(order, TrackingStatus.SHIPPED, order.getSeller().getUsername(),
                "Shipped via " + carrier, trackingNumber, carrier, null);
        changePublisher.orderChanged(order, ChangeType.UPDATE);

        log.info("Order {} shipped by seller {} with {} {}", orderId, sellerId, carrier, trackingNumber);
        return OrderResponse.fromEntity(order);
    }

    /**
     * Courier or seller progress update on a shipped order. Changes the tracking status
     * only; the order status is untouched. DELIVERED is reserved for the buyer.
     */
    @Transactional
    public TrackingResponse addTrackingUpdate(Long orderId, Long actorId, boolean admin,
                                              TrackingStatus status, String notes) {
        if (!COURIER_STATUSES.contains(status)) {
            throw new BusinessLogicException("Tracking status " + status + " cannot be set manually");
        }
        Order order = loadOrder(orderId);
        if (!admin && !order.isSeller(actorId)) {
            throw new UnauthorizedException("Only the seller or an administrator can update tracking");
        }
        if (order.getStatus() != OrderStatus.SHIPPED) {
            throw new InvalidStateTransitionException(order.getStatus().name(), "update tracking");
        }

        String updatedBy = admin ? "courier" : order.getSeller().getUsername();
        TrackingResponse entry = TrackingResponse.fromEntity(
                trackingService.record(order, status, updatedBy, notes, order.getTrackingNumber(), order.getCarrier(), null));

        order.setTrackingStatus(status);
        order.setUpdatedAt(clock.instant());
        order = orderRepository.save(order);
        changePublisher.orderChanged(order, ChangeType.UPDATE);
        return entry;
    }

    /**
     * Cancels an order that has not been paid and puts the listing back on sale.
     */
    @Transactional
    public OrderResponse cancelOrder(Long orderId, Long actorId) {
        Order order = loadOrder(orderId);
        if (!order.isParticipant(actorId)) {
            throw new UnauthorizedException("You are not a party to this order");
        }
        return cancel(order, order.isBuyer(actorId) ? order.getBuyer().getUsername() : order.getSeller().getUsername(),
                "Cancelled before payment");
    }

    /**
     * Cancels one expired pending order. Called per row by the expiry sweep so one bad
     * row does not stop the others.
     */
    @Transactional
    public boolean expirePendingOrder(Long orderId) {
        Order order = loadOrder(orderId);
        if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
            return false;
        }
        cancel(order, "system", "Payment window of " + paymentWindow.toMinutes() + " minutes expired");
        return true;
    }

    public List<Long> findExpiredPendingOrderIds() {
        Instant cutoff = clock.instant().minus(paymentWindow);
        return orderRepository.findByStatusAndCreatedAtBefore(OrderStatus.PENDING_PAYMENT, cutoff).stream()
                .map(Order::getOrderId)
                .collect(Collectors.toList());
    }

    public OrderResponse getOrder(Long orderId, Long userId) {
        Order order = loadOrder(orderId);
        if (!order.isParticipant(userId)) {
            throw new UnauthorizedException("You are not a party to this order");
        }
        return OrderResponse.fromEntity(order);
    }

    /**
     * @param role "buyer", "seller" or null for both
     */
    public List<OrderResponse> getUserOrders(Long userId, String role) {
        List<Order> orders;
        if ("buyer".equalsIgnoreCase(role)) {
            orders = orderRepository.findByBuyerUserIdOrderByCreatedAtDesc(userId);
        } else if ("seller".equalsIgnoreCase(role)) {
            orders = orderRepository.findBySellerUserIdOrderByCreatedAtDesc(userId);
        } else {
            orders = orderRepository.findByParticipant(userId);
        }
        return orders.stream().map(OrderResponse::fromEntity).collect(Collectors.toList());
    }

    public List<TrackingResponse> getTrackingHistory(Long orderId, Long userId) {
        Order order = loadOrder(orderId);
        if (!order.isParticipant(userId)) {
            throw new UnauthorizedException("You are not a party to this order");
        }
        return trackingService.getHistory(orderId).stream()
                .map(TrackingResponse::fromEntity)
                .collect(Collectors.toList());
    }

    private OrderResponse cancel(Order order, String cancelledBy, String reason) {
        Long orderId = order.getOrderId();
        Long listingId = order.getListing().getListingId();
        Instant now = clock.instant();
        if (orderRepository.cancelPending(orderId, now) == 0) {
            throw new InvalidStateTransitionException(loadOrder(orderId).getStatus().name(), "cancel");
        }
        listingRepository.compareAndSetStatus(listingId, ListingStatus.PENDING_PAYMENT, ListingStatus.ACTIVE, now);

        Order cancelled = loadOrder(orderId);
        trackingService.record(cancelled, TrackingStatus.CANCELLED, cancelledBy, reason);
        changePublisher.orderChanged(cancelled, ChangeType.UPDATE);

        log.info("Order {} cancelled by {}: {}", orderId, cancelledBy, reason);
        return OrderResponse.fromEntity(cancelled);
    }

    private Order loadOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }
}
