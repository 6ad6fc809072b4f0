package com.flagship.cash_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable entry of a shift's cash log.
 */
@Value
public class CashTransaction {
    UUID id;
    UUID shiftId;
    BigDecimal amount;
    TransactionKind kind;
    String comment;
    String idempotencyKey;
    Instant createdAt;
    Long sequenceNumber;
}
