package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.snapup_be.pojo.enums.OfferDecision;
import se.snapup_be.pojo.enums.OfferStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RespondOfferRequest {

    @NotNull(message = "Decision is required")
    private OfferDecision decision;

    private OfferStatus expectedStatus;
}
