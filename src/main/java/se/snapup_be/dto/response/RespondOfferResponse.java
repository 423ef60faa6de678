package se.snapup_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Result of accepting or declining. {@code order} is present after an ACCEPT;
 * {@code alreadyMaterialized} marks a retried accept that returned the existing order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RespondOfferResponse {
    private OfferResponse offer;
    private OrderResponse order;
    private boolean alreadyMaterialized;
}
