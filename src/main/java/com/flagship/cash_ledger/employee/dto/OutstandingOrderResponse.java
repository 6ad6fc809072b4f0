package com.flagship.cash_ledger.employee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.order.Order;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class OutstandingOrderResponse {

    @JsonProperty("order_id")
    Long orderId;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("cash_shift_id")
    UUID cashShiftId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static OutstandingOrderResponse from(Order order) {
        return new OutstandingOrderResponse(order.getId(), order.getTotalPrice(), order.getCashShiftId(),
            order.getCreatedAt());
    }
}
