package com.flagship.cash_ledger.exception;

import java.util.UUID;

public class ShiftNotFoundException extends ResourceNotFoundException {

    public ShiftNotFoundException(UUID shiftId) {
        super("Cash shift not found: " + shiftId);
    }
}
