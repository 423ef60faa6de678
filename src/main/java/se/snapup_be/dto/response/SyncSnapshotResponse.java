package se.snapup_be.dto.response;

import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncSnapshotResponse {
    private Long userId;
    private Instant takenAt;
    @Builder.Default
    private List<OfferResponse> offers = new ArrayList<>();
    @Builder.Default
    private List<OrderResponse> orders = new ArrayList<>();
    @Builder.Default
    private List<EscrowHoldResponse> holds = new ArrayList<>();
    @Builder.Default
    private List<DisputeResponse> disputes = new ArrayList<>();
}
