package com.flagship.cash_ledger.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Published by the order subsystem when an order reaches a completed status.
 */
@Value
@Builder
@Jacksonized
public class OrderCompletedEvent {
    public static final String EVENT_TYPE = "OrderCompleted";

    UUID eventId;
    String eventType;
    Long orderId;
    Long actingEmployeeId;   // null when completed by the system
    Instant occurredAt;
}
