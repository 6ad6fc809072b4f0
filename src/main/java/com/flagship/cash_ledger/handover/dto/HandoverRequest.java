package com.flagship.cash_ledger.handover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class HandoverRequest {

    @NotNull(message = "Employee ID is required")
    @JsonProperty("employee_id")
    Long employeeId;

    @NotEmpty(message = "At least one order ID is required")
    @JsonProperty("order_ids")
    List<@NotNull Long> orderIds;
}
