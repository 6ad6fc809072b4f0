package com.flagship.cash_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about the cash ledger published to other systems.
 *
 * Events are written to the outbox in the same transaction as the change
 * they describe and keyed by the shift they concern.
 */
public interface LedgerEvent {

    String AGGREGATE_TYPE = "CashShift";

    /**
     * Unique identifier of this event instance, used by consumers for deduplication.
     */
    UUID getEventId();

    UUID getShiftId();

    Instant getOccurredAt();

    String getEventType();
}
