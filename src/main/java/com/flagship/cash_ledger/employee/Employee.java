package com.flagship.cash_ledger.employee;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Employee as seen by the ledger: identity plus the cash they hold on the
 * business's behalf.
 */
@Value
public class Employee {
    Long id;
    String fullName;
    BigDecimal cashBalance;
}
