package com.flagship.cash_ledger.event;

import com.flagship.cash_ledger.shift.Shift;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when a shift is closed. Carries the frozen Z-report figures so
 * report destinations do not need to query the ledger back.
 */
@Value
public class ShiftClosedEvent implements LedgerEvent {
    UUID eventId;
    UUID shiftId;
    Long employeeId;
    BigDecimal startCash;
    BigDecimal totalSalesCash;
    BigDecimal totalSalesCard;
    BigDecimal serviceIn;
    BigDecimal serviceOut;
    BigDecimal theoreticalCash;
    BigDecimal endCashActual;
    BigDecimal discrepancy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShiftClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ShiftClosedEvent fromShift(Shift shift) {
        if (!shift.isClosed()) {
            throw new IllegalArgumentException("Shift " + shift.getId() + " is not closed");
        }
        return new ShiftClosedEvent(
            UUID.randomUUID(),
            shift.getId(),
            shift.getEmployeeId(),
            shift.getStartCash(),
            shift.getTotals().getSalesCash(),
            shift.getTotals().getSalesCard(),
            shift.getTotals().getServiceIn(),
            shift.getTotals().getServiceOut(),
            shift.getTotals().getTheoreticalCash(),
            shift.getEndCashActual(),
            shift.getDiscrepancy(),
            shift.getEndTime()
        );
    }
}
