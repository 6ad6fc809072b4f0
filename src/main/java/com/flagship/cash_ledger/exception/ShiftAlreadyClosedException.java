package com.flagship.cash_ledger.exception;

import java.util.UUID;

/**
 * Close was requested for a shift that has already been closed.
 */
public class ShiftAlreadyClosedException extends ShiftClosedException {

    public ShiftAlreadyClosedException(UUID shiftId) {
        super(shiftId, "Cash shift " + shiftId + " is already closed");
    }
}
