package com.flagship.cash_ledger.handover;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a handover.
 */
@Value
public class HandoverResult {
    UUID shiftId;
    Long employeeId;
    /** The HANDOVER_IN entry; null when the settled orders total zero. */
    UUID transactionId;
    BigDecimal amount;
    List<Long> settledOrderIds;
    BigDecimal remainingBalance;
}
