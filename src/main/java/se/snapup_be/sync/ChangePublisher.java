package se.snapup_be.sync;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import se.snapup_be.dto.response.DisputeResponse;
import se.snapup_be.dto.response.EscrowHoldResponse;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.pojo.Dispute;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.Offer;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.User;

import java.util.Set;

/**
 * Turns entity writes into {@link EntityChangedEvent}s addressed to both parties.
 * Must be called inside the writing transaction so lazy relations resolve.
 */
@Component
@RequiredArgsConstructor
public class ChangePublisher {

    private final ApplicationEventPublisher eventPublisher;

    public void offerChanged(Offer offer, ChangeType changeType) {
        publish(ChangeEvent.offer(OfferResponse.fromEntity(offer), changeType), offer.getBuyer(), offer.getSeller());
    }

    public void orderChanged(Order order, ChangeType changeType) {
        publish(ChangeEvent.order(OrderResponse.fromEntity(order), changeType), order.getBuyer(), order.getSeller());
    }

    public void holdChanged(EscrowHold hold, ChangeType changeType) {
        publish(ChangeEvent.hold(EscrowHoldResponse.fromEntity(hold), changeType), hold.getBuyer(), hold.getSeller());
    }

    public void disputeChanged(Dispute dispute, ChangeType changeType) {
        Order order = dispute.getOrder();
        publish(ChangeEvent.dispute(DisputeResponse.fromEntity(dispute), changeType), order.getBuyer(), order.getSeller());
    }

    private void publish(ChangeEvent change, User buyer, User seller) {
        eventPublisher.publishEvent(new EntityChangedEvent(change, Set.of(buyer.getUsername(), seller.getUsername())));
    }
}
