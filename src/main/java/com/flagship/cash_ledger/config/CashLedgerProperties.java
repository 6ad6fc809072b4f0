package com.flagship.cash_ledger.config;

import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings under {@code cash-ledger.*}.
 *
 * Event destinations are passed explicitly to publishers and listeners
 * instead of being read from the environment at call time.
 */
@Value
@ConfigurationProperties(prefix = "cash-ledger")
public class CashLedgerProperties {

    Topics topics;

    /**
     * How long manual transaction idempotency keys are cached in Redis.
     */
    Duration idempotencyTtl;

    public CashLedgerProperties(@DefaultValue Topics topics,
                                @DefaultValue("7d") Duration idempotencyTtl) {
        this.topics = topics;
        this.idempotencyTtl = idempotencyTtl;
    }

    @Value
    public static class Topics {
        String ledgerEvents;
        String orderEvents;

        public Topics(@DefaultValue("cash-ledger-events") String ledgerEvents,
                      @DefaultValue("order-events") String orderEvents) {
            this.ledgerEvents = ledgerEvents;
            this.orderEvents = orderEvents;
        }
    }
}
