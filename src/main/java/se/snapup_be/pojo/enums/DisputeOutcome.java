package se.snapup_be.pojo.enums;

/**
 * How an administrator settles a dispute and what happens to the escrow hold.
 */
public enum DisputeOutcome {
    // Dispute withdrawn or dismissed, the hold resumes its original countdown.
    CLOSE(DisputeStatus.CLOSED),

    RELEASE_TO_SELLER(DisputeStatus.RESOLVED_NO_REFUND),

    REFUND_TO_BUYER(DisputeStatus.RESOLVED_REFUND),

    // Part of the held amount goes back to the buyer, the rest to the seller.
    SPLIT(DisputeStatus.RESOLVED_PARTIAL_REFUND);

    private final DisputeStatus resultingStatus;

    DisputeOutcome(DisputeStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public DisputeStatus getResultingStatus() {
        return resultingStatus;
    }

    public static DisputeOutcome forStatus(DisputeStatus status) {
        for (DisputeOutcome outcome : values()) {
            if (outcome.resultingStatus == status) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("No outcome resolves a dispute to " + status);
    }
}
