package com.flagship.cash_ledger.exception;

import java.util.List;

public class NoEligibleOrdersException extends IllegalStateException {

    public NoEligibleOrdersException(List<Long> requestedOrderIds) {
        super("No cash orders awaiting handover among " + requestedOrderIds);
    }
}
