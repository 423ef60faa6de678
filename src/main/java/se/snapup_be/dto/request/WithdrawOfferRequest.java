package se.snapup_be.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.snapup_be.pojo.enums.OfferStatus;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawOfferRequest {
    private OfferStatus expectedStatus;
}
