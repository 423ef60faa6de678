package se.snapup_be.dto.response;

import lombok.*;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.ReleaseConditions;
import se.snapup_be.pojo.enums.EscrowStatus;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscrowHoldResponse {
    private Long holdId;
    private Long orderId;
    private Long listingId;
    private Long buyerId;
    private Long sellerId;
    private Long amount;
    private Long commissionAmount;
    private Long netSellerAmount;
    private EscrowStatus status;
    private Instant deliveryConfirmedAt;
    private Instant releaseAt;
    private Instant releasedAt;
    private ReleaseConditions releaseConditions;
    private Instant createdAt;
    private Instant updatedAt;

    public static EscrowHoldResponse fromEntity(EscrowHold hold) {
        return EscrowHoldResponse.builder()
                .holdId(hold.getHoldId())
                .orderId(hold.getOrder().getOrderId())
                .listingId(hold.getOrder().getListing().getListingId())
                .buyerId(hold.getBuyer().getUserId())
                .sellerId(hold.getSeller().getUserId())
                .amount(hold.getAmount())
                .commissionAmount(hold.getCommissionAmount())
                .netSellerAmount(hold.getNetSellerAmount())
                .status(hold.getStatus())
                .deliveryConfirmedAt(hold.getDeliveryConfirmedAt())
                .releaseAt(hold.getReleaseAt())
                .releasedAt(hold.getReleasedAt())
                .releaseConditions(hold.getReleaseConditions())
                .createdAt(hold.getCreatedAt())
                .updatedAt(hold.getUpdatedAt())
                .build();
    }
}
