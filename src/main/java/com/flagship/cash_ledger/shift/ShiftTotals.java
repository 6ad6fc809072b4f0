package com.flagship.cash_ledger.shift;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Totals frozen onto a shift when it is closed (Z-report).
 */
@Value
public class ShiftTotals {
    BigDecimal salesCash;
    BigDecimal salesCard;
    BigDecimal serviceIn;
    BigDecimal serviceOut;
    BigDecimal theoreticalCash;
}
