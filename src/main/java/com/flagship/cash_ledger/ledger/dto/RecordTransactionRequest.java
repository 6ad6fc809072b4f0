package com.flagship.cash_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.ledger.TransactionKind;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Manual deposit or withdrawal. Range and scale of the amount are checked by the ledger.
 */
@Value
public class RecordTransactionRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    TransactionKind kind;

    @Size(max = 500, message = "Comment must be at most 500 characters")
    @JsonProperty("comment")
    String comment;
}
