package com.flagship.cash_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class OpenShiftRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    Long employeeId;

    @NotNull(message = "Start cash is required")
    @JsonProperty("start_cash")
    BigDecimal startCash;
}
