package se.snapup_be.dto.response;

import lombok.*;
import se.snapup_be.pojo.OrderTracking;
import se.snapup_be.pojo.enums.TrackingStatus;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingResponse {
    private Long trackingId;
    private Long orderId;
    private TrackingStatus status;
    private String trackingNumber;
    private String carrier;
    private String notes;
    private String photoUrl;
    private String updatedBy;
    private Instant occurredAt;

    public static TrackingResponse fromEntity(OrderTracking tracking) {
        return TrackingResponse.builder()
                .trackingId(tracking.getTrackingId())
                .orderId(tracking.getOrder().getOrderId())
                .status(tracking.getStatus())
                .trackingNumber(tracking.getTrackingNumber())
                .carrier(tracking.getCarrier())
                .notes(tracking.getNotes())
                .photoUrl(tracking.getPhotoUrl())
                .updatedBy(tracking.getUpdatedBy())
                .occurredAt(tracking.getOccurredAt())
                .build();
    }
}
