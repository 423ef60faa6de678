package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.snapup_be.pojo.enums.DisputeOutcome;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveDisputeRequest {

    @NotNull(message = "Outcome is required")
    private DisputeOutcome outcome;

    // buyer refund in cents, SPLIT only
    @Positive
    private Long resolutionAmount;

    @Size(max = 2000)
    private String notes;
}
