package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.snapup_be.pojo.enums.EscrowStatus;

import java.time.Instant;

@Entity
@Table(name = "escrow_holds", uniqueConstraints = {
        @UniqueConstraint(name = "uk_escrow_holds_order", columnNames = "order_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscrowHold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long holdId;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @ToString.Exclude
    private Order order;

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

    @Column(nullable = false)
    private Long commissionAmount;

    @Column(nullable = false)
    private Long netSellerAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EscrowStatus status = EscrowStatus.PENDING;

    @Column(nullable = false, updatable = false)
    private Instant deliveryConfirmedAt;

    // fixed at creation, a dispute never moves it
    @Column(nullable = false, updatable = false)
    private Instant releaseAt;

    private Instant releasedAt;

    @Embedded
    @Builder.Default
    private ReleaseConditions releaseConditions = new ReleaseConditions();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;
}
