package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.snapup_be.pojo.enums.OfferStatus;

import java.time.Instant;

@Entity
@Table(name = "offers", uniqueConstraints = {
        @UniqueConstraint(name = "uk_offers_active_thread", columnNames = "active_key")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Offer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long offerId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "listing_id", nullable = false)
    @ToString.Exclude
    private Listing listing;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "buyer_id", nullable = false)
    @ToString.Exclude
    private User buyer;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "seller_id", nullable = false)
    @ToString.Exclude
    private User seller;

    @Column(nullable = false)
    private Long amount;

    private Long counterAmount;

    @Column(columnDefinition = "text")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private OfferStatus status = OfferStatus.PENDING;

    /**
     * Set to the (listing, buyer, seller) thread key while the offer is PENDING or COUNTERED,
     * null once terminal. The unique constraint keeps one active offer per thread.
     */
    @Column(name = "active_key", length = 64)
    private String activeKey;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static String threadKey(Long listingId, Long buyerId, Long sellerId) {
        return listingId + ":" + buyerId + ":" + sellerId;
    }

    /**
     * The price both parties agreed on. A counter amount takes precedence.
     */
    public Long getAgreedAmount() {
        return counterAmount != null ? counterAmount : amount;
    }

    public boolean isBuyer(Long userId) {
        return buyer != null && buyer.getUserId().equals(userId);
    }

    public boolean isSeller(Long userId) {
        return seller != null && seller.getUserId().equals(userId);
    }
}
