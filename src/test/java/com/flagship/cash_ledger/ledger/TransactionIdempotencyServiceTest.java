package com.flagship.cash_ledger.ledger;

import com.flagship.cash_ledger.config.CashLedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Redis fast path and database fallback of Idempotency-Key resolution.
 */
class TransactionIdempotencyServiceTest {

    private static final Duration TTL = Duration.ofDays(7);

    private CashTransactionService transactionService;
    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private TransactionIdempotencyService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        transactionService = mock(CashTransactionService.class);
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        CashLedgerProperties properties = new CashLedgerProperties(
                new CashLedgerProperties.Topics("cash-ledger-events", "order-events"), TTL);
        service = new TransactionIdempotencyService(transactionService, Optional.of(redisTemplate), properties);
    }

    @Test
    @DisplayName("Cached key is answered from Redis without touching the database")
    void testRedisHit() {
        UUID id = UUID.randomUUID();
        when(valueOperations.get("cash-ledger:idempotency:key-1")).thenReturn(id.toString());

        assertEquals(Optional.of(id), service.findTransactionId("key-1"));
        verifyNoInteractions(transactionService);
    }

    @Test
    @DisplayName("Redis miss falls back to the database and re-caches the key")
    void testDatabaseFallback() {
        CashTransaction stored = transaction("key-2");
        when(valueOperations.get(anyString())).thenReturn(null);
        when(transactionService.findByIdempotencyKey("key-2")).thenReturn(Optional.of(stored));

        assertEquals(Optional.of(stored.getId()), service.findTransactionId("key-2"));
        verify(valueOperations).set("cash-ledger:idempotency:key-2", stored.getId().toString(), TTL);
    }

    @Test
    @DisplayName("Redis failure is tolerated and the database answers")
    void testRedisUnavailable() {
        CashTransaction stored = transaction("key-3");
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        when(transactionService.findByIdempotencyKey("key-3")).thenReturn(Optional.of(stored));

        assertEquals(Optional.of(stored.getId()), service.findTransactionId("key-3"));
        assertDoesNotThrow(() -> service.remember("key-3", stored.getId()));
    }

    @Test
    @DisplayName("Unknown key resolves to empty")
    void testUnknownKey() {
        when(transactionService.findByIdempotencyKey("fresh")).thenReturn(Optional.empty());

        assertTrue(service.findTransactionId("fresh").isEmpty());
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("Works without Redis configured")
    void testWithoutRedis() {
        CashTransaction stored = transaction("key-4");
        when(transactionService.findByIdempotencyKey("key-4")).thenReturn(Optional.of(stored));
        TransactionIdempotencyService databaseOnly = new TransactionIdempotencyService(
                transactionService, Optional.empty(),
                new CashLedgerProperties(new CashLedgerProperties.Topics("a", "b"), TTL));

        assertEquals(Optional.of(stored.getId()), databaseOnly.findTransactionId("key-4"));
        assertDoesNotThrow(() -> databaseOnly.remember("key-4", stored.getId()));
    }

    @Test
    @DisplayName("Blank or oversized keys are rejected")
    void testInvalidKeys() {
        assertThrows(IllegalArgumentException.class, () -> service.findTransactionId(" "));
        assertThrows(IllegalArgumentException.class, () -> service.findTransactionId(null));
        assertThrows(IllegalArgumentException.class, () -> service.findTransactionId("k".repeat(256)));
        assertThrows(IllegalArgumentException.class, () -> service.remember("key", null));
        verify(valueOperations, never()).set(anyString(), anyString(), eq(TTL));
    }

    private static CashTransaction transaction(String key) {
        return new CashTransaction(UUID.randomUUID(), UUID.randomUUID(), new BigDecimal("10.00"),
                TransactionKind.MANUAL_IN, null, key, Instant.now(), 1L);
    }
}
