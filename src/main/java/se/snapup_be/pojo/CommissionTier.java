package se.snapup_be.pojo;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "commission_tiers")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommissionTier {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long tierId;

    // sale prices below this pay lowRate
    @Column(nullable = false)
    private Long lowThreshold;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal lowRate;

    // sale prices up to and including this pay midRate, above it highRate
    @Column(nullable = false)
    private Long midThreshold;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal midRate;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal highRate;

    @Column(nullable = false)
    private Instant createdAt;
}
