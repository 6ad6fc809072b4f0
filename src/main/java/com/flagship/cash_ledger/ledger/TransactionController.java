package com.flagship.cash_ledger.ledger;

import com.flagship.cash_ledger.ledger.dto.CashTransactionResponse;
import com.flagship.cash_ledger.ledger.dto.RecordTransactionRequest;
import com.flagship.cash_ledger.observability.CorrelationContext;
import com.flagship.cash_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Manual deposits and withdrawals on a shift, plus the shift's cash log.
 *
 * Handover entries are created only by the handover endpoint. An optional
 * Idempotency-Key header makes a retried request return the entry recorded by
 * the first attempt instead of moving the cash twice.
 */
@RestController
@RequestMapping("/api/shifts/{shiftId}/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CashTransactionService transactionService;
    private final TransactionIdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping
    public ResponseEntity<CashTransactionResponse> recordTransaction(
            @PathVariable("shiftId") UUID shiftId,
            @Valid @RequestBody RecordTransactionRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        if (!request.getKind().isManual()) {
            throw new IllegalArgumentException("Only MANUAL_IN and MANUAL_OUT can be recorded directly, got "
                    + request.getKind());
        }

        long startTime = System.currentTimeMillis();
        CorrelationContext.setShiftId(shiftId);
        try {
            if (idempotencyKey != null) {
                Optional<CashTransaction> existing = findExisting(idempotencyKey);
                if (existing.isPresent()) {
                    return replay(shiftId, existing.get());
                }
                metrics.recordIdempotencyMiss();
            }

            CashTransaction recorded = transactionService.recordTransaction(
                    shiftId, request.getAmount(), request.getKind(), request.getComment(), idempotencyKey);

            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, recorded.getId());
            }

            metrics.recordLatency("record_transaction", System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED).body(CashTransactionResponse.from(recorded));
        } finally {
            CorrelationContext.clearShiftId();
        }
    }

    @GetMapping
    public ResponseEntity<List<CashTransactionResponse>> listTransactions(@PathVariable("shiftId") UUID shiftId) {
        List<CashTransactionResponse> body = transactionService.listTransactions(shiftId).stream()
                .map(CashTransactionResponse::from)
                .toList();
        return ResponseEntity.ok(body);
    }

    private Optional<CashTransaction> findExisting(String idempotencyKey) {
        return idempotencyService.findTransactionId(idempotencyKey)
                .map(id -> transactionService.findById(id)
                        .orElseThrow(() -> new IllegalStateException(
                                "Transaction found by idempotency key but not by id: " + id)));
    }

    private ResponseEntity<CashTransactionResponse> replay(UUID shiftId, CashTransaction existing) {
        if (!existing.getShiftId().equals(shiftId)) {
            throw new IllegalStateException("Idempotency key was already used for shift " + existing.getShiftId());
        }
        metrics.recordIdempotencyHit();
        log.info("Idempotency key already used, returning transaction {}", existing.getId());
        return ResponseEntity.ok(CashTransactionResponse.from(existing));
    }
}
