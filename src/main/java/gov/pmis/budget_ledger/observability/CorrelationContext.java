package gov.pmis.budget_ledger.observability;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String BUDGET_LINE_ID_MDC_KEY = "budgetLineId";
    public static final String APPROVAL_REQUEST_ID_MDC_KEY = "approvalRequestId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generating one on first access.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Adopts a caller-supplied id. Ids that are missing, too long or contain anything but
     * letters, digits, dot, dash and underscore are replaced, so they never reach the logs.
     */
    public static void setCorrelationId(String id) {
        correlationId.set(id != null && ACCEPTED_ID.matcher(id).matches() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short random id; eight hex characters are enough to follow a request through the logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
