package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposeOfferRequest {

    @NotNull(message = "Listing ID is required")
    private Long listingId;

    @NotNull(message = "Seller ID is required")
    private Long sellerId;

    // cents
    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private Long amount;

    @Size(max = 500, message = "Message cannot exceed 500 characters")
    private String message;

    // send despite a WARN verdict on the message
    private boolean overrideWarning;
}
