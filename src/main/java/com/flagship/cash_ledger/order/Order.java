package com.flagship.cash_ledger.order;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read view of the payment fields of an order.
 */
@Value
public class Order {
    Long id;
    PaymentMethod paymentMethod;
    BigDecimal totalPrice;
    boolean cashTurnedIn;
    UUID cashShiftId;
    Long courierId;
    Long waiterId;
    Instant createdAt;
}
