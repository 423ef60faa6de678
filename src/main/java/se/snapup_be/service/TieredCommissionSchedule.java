package se.snapup_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import se.snapup_be.pojo.CommissionTier;
import se.snapup_be.repository.CommissionTierRepository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Three-band commission: below the low threshold, up to and including the mid threshold,
 * and above it. The newest {@link CommissionTier} row wins and is cached for a few minutes.
 */
@Service
@Slf4j
public class TieredCommissionSchedule implements CommissionSchedule {

    private static final Duration CACHE_TTL = Duration.ofMinutes(5);

    private final CommissionTierRepository commissionTierRepository;
    private final Clock clock;
    private final CommissionTier defaults;

    private volatile CommissionTier cached;
    private volatile Instant cachedAt;

    public TieredCommissionSchedule(CommissionTierRepository commissionTierRepository,
                                    Clock clock,
                                    @Value("${snapup.commission.low-threshold:50000}") long lowThreshold,
                                    @Value("${snapup.commission.low-rate:0.12}") BigDecimal lowRate,
                                    @Value("${snapup.commission.mid-threshold:200000}") long midThreshold,
                                    @Value("${snapup.commission.mid-rate:0.10}") BigDecimal midRate,
                                    @Value("${snapup.commission.high-rate:0.05}") BigDecimal highRate) {
        this.commissionTierRepository = commissionTierRepository;
        this.clock = clock;
        this.defaults = CommissionTier.builder()
                .lowThreshold(lowThreshold)
                .lowRate(lowRate)
                .midThreshold(midThreshold)
                .midRate(midRate)
                .highRate(highRate)
                .build();
    }

    @Override
    public FeeBreakdown computeFee(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        CommissionTier tier = currentTier();

        BigDecimal rate;
        String band;
        if (amount < tier.getLowThreshold()) {
            rate = tier.getLowRate();
            band = "LOW";
        } else if (amount <= tier.getMidThreshold()) {
            rate = tier.getMidRate();
            band = "MID";
        } else {
            rate = tier.getHighRate();
            band = "HIGH";
        }

        long fee = BigDecimal.valueOf(amount)
                .multiply(rate)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();

        return FeeBreakdown.builder()
                .amount(amount)
                .fee(fee)
                .net(amount - fee)
                .rate(rate)
                .tier(band)
                .build();
    }

    public void invalidate() {
        cached = null;
        cachedAt = null;
    }

    CommissionTier currentTier() {
        Instant now = clock.instant();
        CommissionTier tier = cached;
        Instant loadedAt = cachedAt;
        if (tier != null && loadedAt != null && now.isBefore(loadedAt.plus(CACHE_TTL))) {
            return tier;
        }
        tier = commissionTierRepository.findFirstByOrderByCreatedAtDesc().orElse(defaults);
        if (tier == defaults) {
            log.debug("No commission tier configured, using defaults");
        }
        cached = tier;
        cachedAt = now;
        return tier;
    }
}
