package com.flagship.cash_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CloseShiftRequest {

    @NotNull(message = "Counted cash is required")
    @JsonProperty("end_cash_actual")
    BigDecimal endCashActual;

    @JsonCreator
    public CloseShiftRequest(@JsonProperty("end_cash_actual") BigDecimal endCashActual) {
        this.endCashActual = endCashActual;
    }
}
