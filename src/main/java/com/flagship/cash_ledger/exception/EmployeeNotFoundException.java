package com.flagship.cash_ledger.exception;

public class EmployeeNotFoundException extends ResourceNotFoundException {

    public EmployeeNotFoundException(Long employeeId) {
        super("Employee not found: " + employeeId);
    }
}
