package com.flagship.cash_ledger.exception;

/**
 * Base type for lookups of shifts, employees and orders that do not exist.
 * Mapped to 404 by {@link GlobalExceptionHandler}.
 */
public abstract class ResourceNotFoundException extends RuntimeException {

    protected ResourceNotFoundException(String message) {
        super(message);
    }
}
