package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.snapup_be.pojo.enums.TrackingStatus;

import java.time.Instant;

@Entity
@Table(name = "order_tracking")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderTracking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long trackingId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @ToString.Exclude
    private Order order;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TrackingStatus status;

    @Column(length = 100)
    private String trackingNumber;

    @Column(length = 50)
    private String carrier;

    @Column(length = 512)
    private String notes;

    @Column(length = 512)
    private String photoUrl;

    // who recorded the entry: a username, "courier" or "system"
    @Column(length = 50)
    private String updatedBy;

    @Column(nullable = false)
    private Instant occurredAt;
}
