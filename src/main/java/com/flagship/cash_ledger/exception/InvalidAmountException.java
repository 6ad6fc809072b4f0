package com.flagship.cash_ledger.exception;

/**
 * A cash amount failed validation before any state was touched.
 */
public class InvalidAmountException extends IllegalArgumentException {

    public InvalidAmountException(String message) {
        super(message);
    }
}
