package com.flagship.cash_ledger.event;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class CashHandedOverEvent implements LedgerEvent {
    UUID eventId;
    UUID shiftId;
    UUID transactionId;
    Long employeeId;
    BigDecimal amount;
    List<Long> orderIds;
    BigDecimal remainingBalance;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CashHandedOver";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CashHandedOverEvent of(UUID shiftId, UUID transactionId, Long employeeId,
                                         BigDecimal amount, List<Long> orderIds,
                                         BigDecimal remainingBalance) {
        return new CashHandedOverEvent(
            UUID.randomUUID(),
            shiftId,
            transactionId,
            employeeId,
            amount,
            List.copyOf(orderIds),
            remainingBalance,
            Instant.now()
        );
    }
}
