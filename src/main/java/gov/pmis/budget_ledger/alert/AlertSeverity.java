package gov.pmis.budget_ledger.alert;

import java.math.BigDecimal;

public enum AlertSeverity {
    WARNING("Budget approaching limit"),
    HIGH("Budget almost depleted"),
    CRITICAL("Budget exceeded");

    private static final BigDecimal CRITICAL_PERCENT = BigDecimal.valueOf(100);
    private static final BigDecimal HIGH_PERCENT = BigDecimal.valueOf(90);

    private final String message;

    AlertSeverity(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    /**
     * CRITICAL from 100%, HIGH from 90%, WARNING below that.
     */
    public static AlertSeverity forUtilization(BigDecimal utilizationPercent) {
        if (utilizationPercent.compareTo(CRITICAL_PERCENT) >= 0) {
            return CRITICAL;
        }
        if (utilizationPercent.compareTo(HIGH_PERCENT) >= 0) {
            return HIGH;
        }
        return WARNING;
    }
}
