package com.flagship.cash_ledger.exception;

import java.util.UUID;

/**
 * A mutation targeted a shift that is already closed.
 */
public class ShiftClosedException extends IllegalStateException {

    private final UUID shiftId;

    public ShiftClosedException(UUID shiftId) {
        this(shiftId, "Cash shift " + shiftId + " is closed");
    }

    protected ShiftClosedException(UUID shiftId, String message) {
        super(message);
        this.shiftId = shiftId;
    }

    public UUID getShiftId() {
        return shiftId;
    }
}
