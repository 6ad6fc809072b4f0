package com.flagship.cash_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.ledger.CashTransaction;
import com.flagship.cash_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CashTransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("shift_id")
    UUID shiftId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("comment")
    String comment;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CashTransactionResponse from(CashTransaction transaction) {
        return CashTransactionResponse.builder()
            .id(transaction.getId())
            .shiftId(transaction.getShiftId())
            .amount(transaction.getAmount())
            .kind(transaction.getKind())
            .comment(transaction.getComment())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
