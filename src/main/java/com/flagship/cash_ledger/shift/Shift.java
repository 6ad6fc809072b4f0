package com.flagship.cash_ledger.shift;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain view of a cash-register shift.
 *
 * A shift goes OPEN → CLOSED exactly once. The cached totals are null while
 * the shift is open and hold the Z-report figures once it is closed.
 */
@Value
public class Shift {
    UUID id;
    Long employeeId;
    Instant startTime;
    Instant endTime;
    BigDecimal startCash;
    BigDecimal endCashActual;
    boolean closed;
    ShiftTotals totals;

    public boolean isOpen() {
        return !closed;
    }

    /**
     * Counted cash minus the cash the ledger expected in the drawer.
     * Negative means a shortage. Null while the shift is open.
     */
    public BigDecimal getDiscrepancy() {
        if (!closed || totals == null || endCashActual == null || totals.getTheoreticalCash() == null) {
            return null;
        }
        return endCashActual.subtract(totals.getTheoreticalCash());
    }
}
