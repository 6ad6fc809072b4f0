package com.flagship.cash_ledger.consumer;

import com.flagship.cash_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs a handler at most once per event and consumer group.
 *
 * The handler and the processed_events row commit in the same transaction:
 * a crash before commit leaves no record and the redelivered event is handled
 * again, a crash after commit makes the redelivery a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final LedgerMetrics metrics;

    /**
     * @return the handler's result, or null when the event was already processed
     */
    @Transactional
    public <T> T processEvent(UUID eventId, String eventType,
                              String aggregateType, String aggregateId,
                              String consumerGroup, Supplier<T> handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return null;
        }

        try {
            T result = handler.get();
            repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));
            metrics.recordEventProcessed(eventType, true);
            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return result;
        } catch (RuntimeException e) {
            metrics.recordEventProcessingFailure(eventType, e.getClass().getSimpleName());
            log.error("Failed to process event {} by consumer group {}: {}", eventId, consumerGroup, e.getMessage());
            throw e;
        }
    }

    /**
     * Records an event as handled without running anything, so it is never retried.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
