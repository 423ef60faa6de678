package se.snapup_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Flags explaining why and how an escrow hold was (or will be) released.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReleaseConditions {

    @Builder.Default
    private boolean deliveryConfirmed = false;

    @Builder.Default
    private boolean disputeWindowPassed = false;

    @Builder.Default
    private boolean noActiveDispute = true;

    @Builder.Default
    private boolean autoReleased = false;

    @Builder.Default
    private boolean adminReleased = false;

    @Builder.Default
    private boolean adminRefunded = false;

    @Builder.Default
    private boolean adminSplit = false;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "seller_amount")
    private Long sellerAmount;
}
