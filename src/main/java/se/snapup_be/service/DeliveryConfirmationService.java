package se.snapup_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import se.snapup_be.dto.response.DeliveryConfirmationResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.sync.ChangePublisher;
import se.snapup_be.sync.ChangeType;

import java.time.Clock;
import java.time.Instant;

/**
 * Buyer-confirmed delivery. The order moves to DELIVERED in one transaction; the escrow
 * hold is started after that commits, and a failure there never undoes the delivery.
 */
@Service
@Slf4j
public class DeliveryConfirmationService {

    private final OrderRepository orderRepository;
    private final TrackingService trackingService;
    private final EscrowService escrowService;
    private final ChangePublisher changePublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DeliveryConfirmationService(OrderRepository orderRepository,
                                       TrackingService trackingService,
                                       EscrowService escrowService,
                                       ChangePublisher changePublisher,
                                       PlatformTransactionManager transactionManager,
                                       Clock clock) {
        this.orderRepository = orderRepository;
        this.trackingService = trackingService;
        this.escrowService = escrowService;
        this.changePublisher = changePublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Confirms delivery of a shipped order. Confirming an order that is already DELIVERED
     * is treated as a retry and only (re)attempts the escrow hold.
     */
    public DeliveryConfirmationResponse confirmDelivery(Long orderId, Long buyerId, String photoUrl) {
        Delivered delivered = transactionTemplate.execute(status -> markDelivered(orderId, buyerId, photoUrl));

        DeliveryConfirmationResponse.DeliveryConfirmationResponseBuilder response = DeliveryConfirmationResponse.builder()
                .order(delivered.order);
        try {
            HoldResult hold = escrowService.startHold(orderId, delivered.deliveredAt);
            response.hold(hold.getHold());
        } catch (Exception e) {
            log.error("Order {} delivered but escrow hold could not be started, left for repair: {}",
                    orderId, e.getMessage(), e);
            response.escrowPending(true);
        }
        return response.build();
    }

    private Delivered markDelivered(Long orderId, Long buyerId, String photoUrl) {
        Order order = loadOrder(orderId);
        if (!order.isBuyer(buyerId)) {
            throw new UnauthorizedException("Only the buyer can confirm delivery");
        }
        if (order.getStatus() == OrderStatus.DELIVERED) {
            log.info("Delivery of order {} already confirmed, retrying escrow hold", orderId);
            return new Delivered(OrderResponse.fromEntity(order), order.getDeliveredAt());
        }
        if (order.getStatus() != OrderStatus.SHIPPED) {
            throw new InvalidStateTransitionException(order.getStatus().name(), "confirm delivery");
        }

        Instant now = clock.instant();
        if (orderRepository.markDelivered(orderId, now) == 0) {
            Order current = loadOrder(orderId);
            if (current.getStatus() == OrderStatus.DELIVERED) {
                return new Delivered(OrderResponse.fromEntity(current), current.getDeliveredAt());
            }
            throw new InvalidStateTransitionException(current.getStatus().name(), "confirm delivery");
        }

        Order updated = loadOrder(orderId);
        String notes = StringUtils.hasText(photoUrl)
                ? "Delivery confirmed by buyer with photo evidence"
                : "Delivery confirmed by buyer";
        trackingService.record(updated, TrackingStatus.DELIVERED, updated.getBuyer().getUsername(), notes,
                updated.getTrackingNumber(), updated.getCarrier(), photoUrl);
        changePublisher.orderChanged(updated, ChangeType.UPDATE);

        log.info("Order {} delivered, confirmed by buyer {}", orderId, buyerId);
        return new Delivered(OrderResponse.fromEntity(updated), now);
    }

    private Order loadOrder(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    }

    private static final class Delivered {
        private final OrderResponse order;
        private final Instant deliveredAt;

        private Delivered(OrderResponse order, Instant deliveredAt) {
            this.order = order;
            this.deliveredAt = deliveredAt;
        }
    }
}
