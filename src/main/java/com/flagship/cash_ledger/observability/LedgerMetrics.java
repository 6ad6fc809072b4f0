package com.flagship.cash_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer meters for the cash ledger.
 *
 * Metrics exposed:
 * - shifts.opened / shifts.closed: shift lifecycle counters
 * - cash.transactions: appended entries, tagged by kind
 * - orders.linked: link outcomes, tagged by outcome
 * - orders.unlinked: completed orders no open shift could take
 * - employee.debt.registered: cash orders moved onto an employee balance
 * - handover.amount: distribution of handed-over cash
 * - ledger.latency: operation timings, tagged by operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter shiftsOpened;
    private final Counter shiftsClosed;
    private final Counter ordersUnlinked;
    private final Counter debtsRegistered;
    private final DistributionSummary handoverAmount;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.shiftsOpened = Counter.builder("shifts.opened")
                .description("Number of cash shifts opened")
                .register(registry);

        this.shiftsClosed = Counter.builder("shifts.closed")
                .description("Number of cash shifts closed")
                .register(registry);

        this.ordersUnlinked = Counter.builder("orders.unlinked")
                .description("Completed orders left without a shift because none was open")
                .register(registry);

        this.debtsRegistered = Counter.builder("employee.debt.registered")
                .description("Cash orders recorded as held by an employee")
                .register(registry);

        this.handoverAmount = DistributionSummary.builder("handover.amount")
                .description("Cash handed over to a cashier per handover")
                .baseUnit("currency")
                .register(registry);
    }

    public void recordShiftOpened() {
        shiftsOpened.increment();
    }

    public void recordShiftClosed(BigDecimal discrepancy) {
        shiftsClosed.increment();
        if (discrepancy != null && discrepancy.signum() != 0) {
            registry.counter("shifts.discrepancy",
                    "direction", discrepancy.signum() < 0 ? "shortage" : "surplus"
            ).increment();
        }
    }

    public void recordTransaction(String kind) {
        registry.counter("cash.transactions", "kind", sanitizeTag(kind)).increment();
    }

    public void recordOrderLinked(String outcome) {
        registry.counter("orders.linked", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordOrderUnlinked() {
        ordersUnlinked.increment();
    }

    public void recordDebtRegistered() {
        debtsRegistered.increment();
    }

    public void recordHandover(BigDecimal amount) {
        handoverAmount.record(amount.doubleValue());
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("event.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    /**
     * Keeps tag values short and free of special characters to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
