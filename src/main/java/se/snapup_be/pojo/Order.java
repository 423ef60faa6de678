package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;

import java.time.Instant;

@Entity
@Table(name = "orders", uniqueConstraints = {
        @UniqueConstraint(name = "uk_orders_offer", columnNames = "offer_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long orderId;

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

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "offer_id")
    @ToString.Exclude
    private Offer offer;

    @Column(nullable = false)
    private Long amount;

    @Column(nullable = false)
    private Long serviceFee;

    @Column(nullable = false)
    private Long total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING_PAYMENT;

    @Column(length = 100)
    private String paymentReference;

    @Column(length = 100)
    private String trackingNumber;

    @Column(length = 50)
    private String carrier;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private TrackingStatus trackingStatus;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    private Instant paidAt;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Instant cancelledAt;

    public boolean isBuyer(Long userId) {
        return buyer != null && buyer.getUserId().equals(userId);
    }

    public boolean isSeller(Long userId) {
        return seller != null && seller.getUserId().equals(userId);
    }

    public boolean isParticipant(Long userId) {
        return isBuyer(userId) || isSeller(userId);
    }
}
