package com.flagship.cash_ledger.exception;

public class ShiftAlreadyOpenException extends IllegalStateException {

    private final Long employeeId;

    public ShiftAlreadyOpenException(Long employeeId) {
        super("Employee " + employeeId + " already has an open cash shift");
        this.employeeId = employeeId;
    }

    public Long getEmployeeId() {
        return employeeId;
    }
}
