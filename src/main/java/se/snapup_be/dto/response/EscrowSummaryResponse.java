package se.snapup_be.dto.response;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscrowSummaryResponse {
    private Long sellerId;
    private long holdingAmount;
    private long disputedAmount;
    private long releasedAmount;
    private int holdingCount;
    private int disputedCount;
    private int releasedCount;
}
