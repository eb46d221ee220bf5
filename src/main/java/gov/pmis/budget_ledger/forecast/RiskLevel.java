package gov.pmis.budget_ledger.forecast;

import java.math.BigDecimal;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * LOW below 50%, MEDIUM below 75%, HIGH below 90%, CRITICAL from 90%.
     */
    public static RiskLevel forUtilization(BigDecimal utilizationPercent) {
        if (utilizationPercent.compareTo(BigDecimal.valueOf(90)) >= 0) {
            return CRITICAL;
        }
        if (utilizationPercent.compareTo(BigDecimal.valueOf(75)) >= 0) {
            return HIGH;
        }
        if (utilizationPercent.compareTo(BigDecimal.valueOf(50)) >= 0) {
            return MEDIUM;
        }
        return LOW;
    }
}
