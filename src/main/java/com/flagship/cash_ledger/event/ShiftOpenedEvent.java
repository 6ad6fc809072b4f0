package com.flagship.cash_ledger.event;

import com.flagship.cash_ledger.shift.Shift;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class ShiftOpenedEvent implements LedgerEvent {
    UUID eventId;
    UUID shiftId;
    Long employeeId;
    BigDecimal startCash;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShiftOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ShiftOpenedEvent fromShift(Shift shift) {
        return new ShiftOpenedEvent(
            UUID.randomUUID(),
            shift.getId(),
            shift.getEmployeeId(),
            shift.getStartCash(),
            shift.getStartTime()
        );
    }
}
