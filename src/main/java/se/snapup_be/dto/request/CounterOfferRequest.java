package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.snapup_be.pojo.enums.OfferStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CounterOfferRequest {

    @NotNull(message = "Counter amount is required")
    @Positive(message = "Counter amount must be positive")
    private Long counterAmount;

    // status the client last saw; a mismatch is rejected as stale
    private OfferStatus expectedStatus;
}
