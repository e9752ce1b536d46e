package com.flagship.ebank_ledger.observability;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Thread-local holder for the request correlation ID.
 *
 * The ID arrives in (or is generated for) each HTTP request and is written to
 * the MDC so every log line of the request carries it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_NUMBER_MDC_KEY = "accountNumber";

    static final int MAX_CORRELATION_ID_LENGTH = 64;
    private static final Pattern CORRELATION_ID_FORMAT =
        Pattern.compile("[A-Za-z0-9-]{1," + MAX_CORRELATION_ID_LENGTH + "}");

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Adopts a client-supplied ID of at most 64 letters, digits and dashes.
     * Anything else is replaced by a generated ID.
     */
    public static void setCorrelationId(String id) {
        correlationId.set(isAcceptable(id) ? id : generateCorrelationId());
    }

    static boolean isAcceptable(String id) {
        return id != null && CORRELATION_ID_FORMAT.matcher(id).matches();
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
