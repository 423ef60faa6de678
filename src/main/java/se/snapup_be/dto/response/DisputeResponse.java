package se.snapup_be.dto.response;

import lombok.*;
import se.snapup_be.pojo.Dispute;
import se.snapup_be.pojo.enums.DisputeReason;
import se.snapup_be.pojo.enums.DisputeStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DisputeResponse {
    private Long disputeId;
    private Long orderId;
    private Long listingId;
    private Long buyerId;
    private Long sellerId;
    private Long raisedById;
    private DisputeReason reason;
    private String description;
    private List<String> evidenceUrls;
    private DisputeStatus status;
    private String sellerResponse;
    private String resolution;
    private Long resolutionAmount;
    private Long resolvedById;
    private String notes;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant resolvedAt;

    public static DisputeResponse fromEntity(Dispute dispute) {
        return DisputeResponse.builder()
                .disputeId(dispute.getDisputeId())
                .orderId(dispute.getOrder().getOrderId())
                .listingId(dispute.getOrder().getListing().getListingId())
                .buyerId(dispute.getOrder().getBuyer().getUserId())
                .sellerId(dispute.getOrder().getSeller().getUserId())
                .raisedById(dispute.getRaisedBy().getUserId())
                .reason(dispute.getReason())
                .description(dispute.getDescription())
                .evidenceUrls(new ArrayList<>(dispute.getEvidenceUrls()))
                .status(dispute.getStatus())
                .sellerResponse(dispute.getSellerResponse())
                .resolution(dispute.getResolution())
                .resolutionAmount(dispute.getResolutionAmount())
                .resolvedById(dispute.getResolvedBy() != null ? dispute.getResolvedBy().getUserId() : null)
                .notes(dispute.getNotes())
                .createdAt(dispute.getCreatedAt())
                .updatedAt(dispute.getUpdatedAt())
                .resolvedAt(dispute.getResolvedAt())
                .build();
    }
}
