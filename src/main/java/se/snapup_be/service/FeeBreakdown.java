package se.snapup_be.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeBreakdown {
    private long amount;
    private long fee;
    private long net;
    private BigDecimal rate;
    private String tier;
}
