package com.avocado.bonus_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation of log lines across one unit of work: an API request or a consumed
 * POS message. The id travels in the X-Correlation-ID header and in the MDC.
 *
 * Besides the correlation id, work on a single sale or client tags its log lines
 * with {@link #TRANSACTION_ID_MDC_KEY} and {@link #CLIENT_ID_MDC_KEY}; {@link #end()}
 * clears all three.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String CLIENT_ID_MDC_KEY = "clientId";

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work under the incoming id, or a fresh one when none was sent.
     *
     * @return the id in effect
     */
    public static String begin(String incomingId) {
        String id = incomingId != null && !incomingId.isBlank() ? incomingId : newId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String currentId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
        MDC.remove(CLIENT_ID_MDC_KEY);
    }

    // eight hex chars are enough to tell concurrent requests apart in the logs
    static String newId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
