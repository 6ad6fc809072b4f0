package com.flagship.cash_ledger.statistics;

import com.flagship.cash_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Money movement over a period: sales of shift-attributed orders by payment
 * method and every cash log entry, newest first.
 */
@Value
@Builder
public class CashFlowReport {
    Instant from;
    Instant to;
    BigDecimal cashRevenue;
    BigDecimal cardRevenue;
    BigDecimal totalRevenue;
    BigDecimal totalExpenses;
    List<Entry> transactions;

    @Value
    public static class Entry {
        UUID transactionId;
        UUID shiftId;
        String cashierName;
        TransactionKind kind;
        BigDecimal amount;
        String comment;
        Instant createdAt;
    }
}
