package com.flagship.cash_ledger.exception;

public class OrderNotFoundException extends ResourceNotFoundException {

    public OrderNotFoundException(Long orderId) {
        super("Order not found: " + orderId);
    }
}
