package com.flagship.cash_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cash_ledger.exception.ResourceNotFoundException;
import com.flagship.cash_ledger.order.OrderCompletionResult;
import com.flagship.cash_ledger.order.OrderCompletionService;
import com.flagship.cash_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Feeds order status transitions into the ledger.
 *
 * Only {@code OrderCompleted} matters; other event types are recorded as
 * skipped. Offsets are acknowledged after the ledger transaction committed.
 * Events that can never succeed (unknown order, malformed payload) are
 * recorded as skipped and acknowledged; other failures are left
 * unacknowledged for redelivery.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OrderEventConsumer {

    static final String CONSUMER_GROUP = "cash-ledger-order-consumer";
    static final String AGGREGATE_TYPE = "Order";

    private final IdempotentEventProcessor eventProcessor;
    private final OrderCompletionService completionService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${cash-ledger.topics.order-events:order-events}",
        groupId = "${spring.kafka.consumer.group-id:cash-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        OrderCompletedEvent event;
        try {
            event = objectMapper.readValue(record.value(), OrderCompletedEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Could not parse order event at offset {}, acknowledging to skip: {}",
                    record.offset(), e.getOriginalMessage());
            ack.acknowledge();
            return;
        }
        if (event.getEventId() == null || event.getOrderId() == null) {
            log.warn("Order event at offset {} lacks eventId or orderId, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        CorrelationContext.setCorrelationId(event.getEventId().toString().substring(0, 8));
        try {
            handle(event);
            ack.acknowledge();
        } finally {
            CorrelationContext.clear();
        }
    }

    void handle(OrderCompletedEvent event) {
        String aggregateId = event.getOrderId().toString();

        if (!OrderCompletedEvent.EVENT_TYPE.equals(event.getEventType())) {
            eventProcessor.skipEvent(event.getEventId(), String.valueOf(event.getEventType()),
                    AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, "Not relevant to the cash ledger");
            return;
        }

        try {
            OrderCompletionResult result = eventProcessor.processEvent(
                    event.getEventId(), event.getEventType(), AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
                    () -> completionService.onOrderCompleted(event.getOrderId(), event.getActingEmployeeId()));
            if (result != null) {
                log.info("Processed OrderCompleted: orderId={}, settlement={}",
                        event.getOrderId(), result.getSettlement());
            }
        } catch (ResourceNotFoundException | IllegalArgumentException e) {
            log.warn("Order event {} rejected permanently: {}", event.getEventId(), e.getMessage());
            eventProcessor.skipEvent(event.getEventId(), event.getEventType(),
                    AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, e.getMessage());
        }
    }
}
