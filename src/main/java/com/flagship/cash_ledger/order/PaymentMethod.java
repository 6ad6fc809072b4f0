package com.flagship.cash_ledger.order;

public enum PaymentMethod {
    CASH,
    CARD
}
