package com.flagship.cash_ledger.handover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.handover.HandoverResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class HandoverResponse {

    @JsonProperty("shift_id")
    UUID shiftId;

    @JsonProperty("employee_id")
    Long employeeId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("settled_order_ids")
    List<Long> settledOrderIds;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    public static HandoverResponse from(HandoverResult result) {
        return HandoverResponse.builder()
            .shiftId(result.getShiftId())
            .employeeId(result.getEmployeeId())
            .transactionId(result.getTransactionId())
            .amount(result.getAmount())
            .settledOrderIds(result.getSettledOrderIds())
            .remainingBalance(result.getRemainingBalance())
            .build();
    }
}
