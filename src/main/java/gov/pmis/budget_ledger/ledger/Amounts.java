package gov.pmis.budget_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary arithmetic shared by the ledger, alert and forecast code.
 * All amounts are carried at scale 2; percentages are rounded HALF_UP to scale 2.
 */
public final class Amounts {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {
    }

    /**
     * True when the value has no more than two significant decimal places
     * (trailing zeros are ignored, so {@code 10.500} qualifies).
     */
    public static boolean hasValidScale(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= SCALE;
    }

    /**
     * Rescales a value that already passed {@link #hasValidScale(BigDecimal)}.
     */
    public static BigDecimal normalize(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * {@code 100 × part / whole}, or zero when {@code whole} is zero.
     */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP);
    }
}
