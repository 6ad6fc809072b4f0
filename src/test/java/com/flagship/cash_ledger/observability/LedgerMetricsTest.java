package com.flagship.cash_ledger.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    @DisplayName("Shift and handover counters are tagged and summed")
    void testCounters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics(registry);

        metrics.recordShiftOpened();
        metrics.recordShiftClosed(new BigDecimal("-10.00"));
        metrics.recordShiftClosed(BigDecimal.ZERO);
        metrics.recordTransaction("MANUAL_OUT");
        metrics.recordHandover(new BigDecimal("150.00"));

        assertEquals(1.0, registry.get("shifts.opened").counter().count());
        assertEquals(2.0, registry.get("shifts.closed").counter().count());
        assertEquals(1.0, registry.get("shifts.discrepancy").tag("direction", "shortage").counter().count());
        assertEquals(1.0, registry.get("cash.transactions").tag("kind", "MANUAL_OUT").counter().count());
        assertEquals(150.0, registry.get("handover.amount").summary().totalAmount());
    }
}
