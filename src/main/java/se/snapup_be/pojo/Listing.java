package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.snapup_be.pojo.enums.ListingStatus;

import java.time.Instant;

@Entity
@Table(name = "listings")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Listing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long listingId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "seller_id", nullable = false)
    @ToString.Exclude
    private User seller;

    @Column(nullable = false, length = 200)
    private String title;

    // asking price in minor units
    @Column(nullable = false)
    private Long price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ListingStatus status = ListingStatus.ACTIVE;

    private Instant createdAt;

    private Instant updatedAt;
}
