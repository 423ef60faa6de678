package se.snapup_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryConfirmationResponse {
    private OrderResponse order;
    private EscrowHoldResponse hold;
    // true when the hold could not be started and will be created by the repair sweep
    private boolean escrowPending;
}
