package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.snapup_be.pojo.enums.DisputeReason;
import se.snapup_be.pojo.enums.DisputeStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "disputes", uniqueConstraints = {
        @UniqueConstraint(name = "uk_disputes_active_order", columnNames = "active_key")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Dispute {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long disputeId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @ToString.Exclude
    private Order order;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "raised_by", nullable = false)
    @ToString.Exclude
    private User raisedBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private DisputeReason reason;

    @Column(columnDefinition = "text")
    private String description;

    @ElementCollection
    @CollectionTable(name = "dispute_evidence", joinColumns = @JoinColumn(name = "dispute_id"))
    @Column(name = "evidence_url", length = 512)
    @Builder.Default
    private List<String> evidenceUrls = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private DisputeStatus status = DisputeStatus.OPEN;

    @Column(columnDefinition = "text")
    private String sellerResponse;

    @Column(length = 255)
    private String resolution;

    private Long resolutionAmount;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "resolved_by")
    @ToString.Exclude
    private User resolvedBy;

    @Column(columnDefinition = "text")
    private String notes;

    // order id while the dispute is OPEN or UNDER_REVIEW, null afterwards
    @Column(name = "active_key")
    private Long activeKey;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    private Instant resolvedAt;
}
