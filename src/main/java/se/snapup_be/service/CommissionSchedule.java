package se.snapup_be.service;

/**
 * Platform commission on a sale amount in minor units.
 */
public interface CommissionSchedule {

    FeeBreakdown computeFee(long amount);
}
