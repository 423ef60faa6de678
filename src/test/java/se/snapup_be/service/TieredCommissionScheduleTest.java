package se.snapup_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.snapup_be.pojo.CommissionTier;
import se.snapup_be.repository.CommissionTierRepository;
import se.snapup_be.support.MutableClock;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TieredCommissionSchedule Unit Tests")
class TieredCommissionScheduleTest {

    @Mock
    private CommissionTierRepository commissionTierRepository;

    private MutableClock clock;
    private TieredCommissionSchedule schedule;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        schedule = new TieredCommissionSchedule(commissionTierRepository, clock,
                50000L, new BigDecimal("0.12"), 200000L, new BigDecimal("0.10"), new BigDecimal("0.05"));
    }

    @Test
    @DisplayName("Uses configured defaults when no tier is stored")
    void defaultsWhenTableEmpty() {
        when(commissionTierRepository.findFirstByOrderByCreatedAtDesc()).thenReturn(Optional.empty());

        FeeBreakdown low = schedule.computeFee(40000L);
        FeeBreakdown mid = schedule.computeFee(90000L);
        FeeBreakdown high = schedule.computeFee(300000L);

        assertThat(low.getFee()).isEqualTo(4800L);
        assertThat(low.getTier()).isEqualTo("LOW");
        assertThat(mid.getFee()).isEqualTo(9000L);
        assertThat(mid.getNet()).isEqualTo(81000L);
        assertThat(mid.getTier()).isEqualTo("MID");
        assertThat(high.getFee()).isEqualTo(15000L);
        assertThat(high.getTier()).isEqualTo("HIGH");
    }

    @Test
    @DisplayName("Band edges: 50 000 and 200 000 fall in the middle band")
    void bandEdges() {
        when(commissionTierRepository.findFirstByOrderByCreatedAtDesc()).thenReturn(Optional.empty());

        assertThat(schedule.computeFee(49999L).getTier()).isEqualTo("LOW");
        assertThat(schedule.computeFee(50000L).getTier()).isEqualTo("MID");
        assertThat(schedule.computeFee(200000L).getTier()).isEqualTo("MID");
        assertThat(schedule.computeFee(200001L).getTier()).isEqualTo("HIGH");
    }

    @Test
    @DisplayName("Fees are rounded half up to whole cents")
    void roundsHalfUp() {
        when(commissionTierRepository.findFirstByOrderByCreatedAtDesc()).thenReturn(Optional.empty());

        // 12% of 12345 = 1481.4, 12% of 12346 = 1481.52
        assertThat(schedule.computeFee(12345L).getFee()).isEqualTo(1481L);
        assertThat(schedule.computeFee(12346L).getFee()).isEqualTo(1482L);
    }

    @Test
    @DisplayName("Stored tier is cached for five minutes")
    void cachesStoredTier() {
        CommissionTier stored = CommissionTier.builder()
                .lowThreshold(10000L).lowRate(new BigDecimal("0.2000"))
                .midThreshold(20000L).midRate(new BigDecimal("0.1500"))
                .highRate(new BigDecimal("0.0100"))
                .createdAt(clock.instant())
                .build();
        when(commissionTierRepository.findFirstByOrderByCreatedAtDesc()).thenReturn(Optional.of(stored));

        assertThat(schedule.computeFee(100000L).getFee()).isEqualTo(1000L);
        clock.advance(Duration.ofMinutes(4));
        schedule.computeFee(100000L);
        verify(commissionTierRepository, times(1)).findFirstByOrderByCreatedAtDesc();

        clock.advance(Duration.ofMinutes(2));
        schedule.computeFee(100000L);
        verify(commissionTierRepository, times(2)).findFirstByOrderByCreatedAtDesc();
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void rejectsNegative() {
        assertThatThrownBy(() -> schedule.computeFee(-1L)).isInstanceOf(IllegalArgumentException.class);
    }
}
