package com.flagship.cash_ledger.employee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.employee.Employee;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class EmployeeBalanceResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("full_name")
    String fullName;

    @JsonProperty("cash_balance")
    BigDecimal cashBalance;

    public static EmployeeBalanceResponse from(Employee employee) {
        return new EmployeeBalanceResponse(employee.getId(), employee.getFullName(), employee.getCashBalance());
    }
}
