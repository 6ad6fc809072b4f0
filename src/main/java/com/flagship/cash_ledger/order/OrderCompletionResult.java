package com.flagship.cash_ledger.order;

import lombok.Value;

import java.util.UUID;

@Value
public class OrderCompletionResult {
    Long orderId;
    UUID shiftId;          // null when no shift was open
    OrderSettlement settlement;
    Long debtorId;         // courier or waiter holding the cash, if any

    public boolean isLinked() {
        return shiftId != null;
    }
}
