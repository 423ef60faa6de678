package se.snapup_be.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.snapup_be.dto.response.DisputeResponse;
import se.snapup_be.dto.response.EscrowHoldResponse;
import se.snapup_be.dto.response.OfferResponse;
import se.snapup_be.dto.response.OrderResponse;

import java.time.Instant;

/**
 * One row-level change as pushed to {@code /user/queue/changes}. {@code payload} is the
 * full row so a client can replace its copy wholesale.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeEvent {
    private EntityType entityType;
    private ChangeType changeType;
    private Long entityId;
    private Long listingId;
    private Long buyerId;
    private Long sellerId;
    private String status;
    private Instant updatedAt;
    // escrow holds only
    private Instant releaseAt;
    private Long orderId;
    private Object payload;

    public static ChangeEvent offer(OfferResponse offer, ChangeType changeType) {
        return ChangeEvent.builder()
                .entityType(EntityType.OFFER)
                .changeType(changeType)
                .entityId(offer.getOfferId())
                .listingId(offer.getListingId())
                .buyerId(offer.getBuyerId())
                .sellerId(offer.getSellerId())
                .status(offer.getStatus().name())
                .updatedAt(offer.getUpdatedAt())
                .payload(offer)
                .build();
    }

    public static ChangeEvent order(OrderResponse order, ChangeType changeType) {
        return ChangeEvent.builder()
                .entityType(EntityType.ORDER)
                .changeType(changeType)
                .entityId(order.getOrderId())
                .orderId(order.getOrderId())
                .listingId(order.getListingId())
                .buyerId(order.getBuyerId())
                .sellerId(order.getSellerId())
                .status(order.getStatus().name())
                .updatedAt(order.getUpdatedAt())
                .payload(order)
                .build();
    }

    public static ChangeEvent hold(EscrowHoldResponse hold, ChangeType changeType) {
        return ChangeEvent.builder()
                .entityType(EntityType.ESCROW_HOLD)
                .changeType(changeType)
                .entityId(hold.getHoldId())
                .orderId(hold.getOrderId())
                .listingId(hold.getListingId())
                .buyerId(hold.getBuyerId())
                .sellerId(hold.getSellerId())
                .status(hold.getStatus().name())
                .updatedAt(hold.getUpdatedAt())
                .releaseAt(hold.getReleaseAt())
                .payload(hold)
                .build();
    }

    public static ChangeEvent dispute(DisputeResponse dispute, ChangeType changeType) {
        return ChangeEvent.builder()
                .entityType(EntityType.DISPUTE)
                .changeType(changeType)
                .entityId(dispute.getDisputeId())
                .orderId(dispute.getOrderId())
                .listingId(dispute.getListingId())
                .buyerId(dispute.getBuyerId())
                .sellerId(dispute.getSellerId())
                .status(dispute.getStatus().name())
                .updatedAt(dispute.getUpdatedAt())
                .payload(dispute)
                .build();
    }

    @JsonIgnore
    public boolean involves(Long userId) {
        return userId != null && (userId.equals(buyerId) || userId.equals(sellerId));
    }
}
