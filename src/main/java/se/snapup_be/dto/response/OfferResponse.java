package se.snapup_be.dto.response;

import lombok.*;
import se.snapup_be.pojo.Offer;
import se.snapup_be.pojo.enums.OfferStatus;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OfferResponse {
    private Long offerId;
    private Long listingId;
    private String listingTitle;
    private Long listingPrice;
    private Long buyerId;
    private String buyerUsername;
    private Long sellerId;
    private String sellerUsername;
    private Long amount;
    private Long counterAmount;
    private Long agreedAmount;
    private String message;
    private OfferStatus status;
    private Instant createdAt;
    private Instant updatedAt;

    public static OfferResponse fromEntity(Offer offer) {
        return OfferResponse.builder()
                .offerId(offer.getOfferId())
                .listingId(offer.getListing().getListingId())
                .listingTitle(offer.getListing().getTitle())
                .listingPrice(offer.getListing().getPrice())
                .buyerId(offer.getBuyer().getUserId())
                .buyerUsername(offer.getBuyer().getUsername())
                .sellerId(offer.getSeller().getUserId())
                .sellerUsername(offer.getSeller().getUsername())
                .amount(offer.getAmount())
                .counterAmount(offer.getCounterAmount())
                .agreedAmount(offer.getAgreedAmount())
                .message(offer.getMessage())
                .status(offer.getStatus())
                .createdAt(offer.getCreatedAt())
                .updatedAt(offer.getUpdatedAt())
                .build();
    }
}
