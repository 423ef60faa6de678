package se.snapup_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import se.snapup_be.service.ReleaseDecision;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EscrowStatusResponse {
    private Long orderId;
    private EscrowHoldResponse hold;
    private DisputeResponse activeDispute;
    private ReleaseDecision decision;
}
