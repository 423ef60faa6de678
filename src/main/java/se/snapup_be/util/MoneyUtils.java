package se.snapup_be.util;

import java.math.BigDecimal;

public final class MoneyUtils {

    private MoneyUtils() {
    }

    /**
     * Formats minor units as rand, e.g. 90000 becomes "R900.00".
     */
    public static String format(long minorUnits) {
        return "R" + BigDecimal.valueOf(minorUnits, 2).toPlainString();
    }
}
