package com.flagship.cash_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id of the current request plus the MDC keys the ledger logs with.
 *
 * The correlation id comes from the {@code X-Correlation-ID} header, or is
 * generated, and is echoed back on the response. Shift and employee ids are
 * put into the MDC by the services that act on them and removed in a finally block.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SHIFT_ID_MDC_KEY = "shiftId";
    public static final String EMPLOYEE_ID_MDC_KEY = "employeeId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId.get());
    }

    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(SHIFT_ID_MDC_KEY);
        MDC.remove(EMPLOYEE_ID_MDC_KEY);
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void setShiftId(UUID shiftId) {
        if (shiftId != null) {
            MDC.put(SHIFT_ID_MDC_KEY, shiftId.toString());
        }
    }

    public static void clearShiftId() {
        MDC.remove(SHIFT_ID_MDC_KEY);
    }

    public static void setEmployeeId(Long employeeId) {
        if (employeeId != null) {
            MDC.put(EMPLOYEE_ID_MDC_KEY, employeeId.toString());
        }
    }

    public static void clearEmployeeId() {
        MDC.remove(EMPLOYEE_ID_MDC_KEY);
    }
}
