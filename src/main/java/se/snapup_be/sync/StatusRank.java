package se.snapup_be.sync;

/**
 * How far along a status is within its entity's lifecycle. Breaks ties between two
 * versions of a row carrying the same {@code updatedAt}.
 */
final class StatusRank {

    private StatusRank() {
    }

    static int of(EntityType type, String status) {
        if (status == null) {
            return -1;
        }
        switch (type) {
            case OFFER:
                switch (status) {
                    case "PENDING": return 0;
                    case "COUNTERED": return 1;
                    default: return 2;
                }
            case ORDER:
                switch (status) {
                    case "PENDING_PAYMENT": return 0;
                    case "PAID": return 1;
                    case "SHIPPED": return 2;
                    case "DELIVERED": return 3;
                    default: return 4;
                }
            case ESCROW_HOLD:
                switch (status) {
                    case "PENDING": return 0;
                    case "DISPUTED": return 1;
                    default: return 2;
                }
            case DISPUTE:
                switch (status) {
                    case "OPEN": return 0;
                    case "UNDER_REVIEW": return 1;
                    default: return 2;
                }
            default:
                return 0;
        }
    }
}
