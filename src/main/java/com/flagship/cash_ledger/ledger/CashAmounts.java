package com.flagship.cash_ledger.ledger;

import com.flagship.cash_ledger.exception.InvalidAmountException;

import java.math.BigDecimal;

/**
 * Validation for cash amounts.
 *
 * Amounts are exact decimals with at most two fraction digits, matching the
 * NUMERIC(19,2) columns. Validation happens before any row is locked or written.
 */
public final class CashAmounts {

    public static final int SCALE = 2;

    private CashAmounts() {
    }

    public static BigDecimal requirePositive(BigDecimal amount, String field) {
        requireWellFormed(amount, field);
        if (amount.signum() <= 0) {
            throw new InvalidAmountException(field + " must be greater than 0, got " + amount.toPlainString());
        }
        return amount;
    }

    public static BigDecimal requireNonNegative(BigDecimal amount, String field) {
        requireWellFormed(amount, field);
        if (amount.signum() < 0) {
            throw new InvalidAmountException(field + " must not be negative, got " + amount.toPlainString());
        }
        return amount;
    }

    private static void requireWellFormed(BigDecimal amount, String field) {
        if (amount == null) {
            throw new InvalidAmountException(field + " is required");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new InvalidAmountException(
                field + " must have at most " + SCALE + " decimal places, got " + amount.toPlainString());
        }
    }
}
