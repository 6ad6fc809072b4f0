package com.flagship.cash_ledger.ledger;

import com.flagship.cash_ledger.exception.ShiftClosedException;
import com.flagship.cash_ledger.exception.ShiftNotFoundException;
import com.flagship.cash_ledger.observability.LedgerMetrics;
import com.flagship.cash_ledger.shift.ShiftEntity;
import com.flagship.cash_ledger.shift.ShiftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Appends entries to the cash transaction log.
 *
 * The log is append-only: rows are written with plain JDBC and a database
 * trigger rejects every UPDATE and DELETE. An append takes a row lock on the
 * owning shift and checks that it is still open under that lock, so an entry
 * can never land in a shift after its Z-report was frozen.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CashTransactionService {

    private static final String SELECT_COLUMNS =
        "SELECT id, shift_id, amount, kind, comment, idempotency_key, created_at, sequence_number FROM cash_transactions ";

    private static final RowMapper<CashTransaction> ROW_MAPPER = (rs, rowNum) -> new CashTransaction(
        rs.getObject("id", UUID.class),
        rs.getObject("shift_id", UUID.class),
        rs.getBigDecimal("amount"),
        TransactionKind.valueOf(rs.getString("kind")),
        rs.getString("comment"),
        rs.getString("idempotency_key"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getLong("sequence_number")
    );

    private final JdbcTemplate jdbcTemplate;
    private final ShiftRepository shiftRepository;
    private final LedgerMetrics metrics;

    /**
     * Records a cash movement on an open shift.
     *
     * @throws com.flagship.cash_ledger.exception.InvalidAmountException if amount is not a positive 2-decimal value
     * @throws ShiftNotFoundException if the shift does not exist
     * @throws ShiftClosedException if the shift is closed
     */
    @Transactional
    public CashTransaction recordTransaction(UUID shiftId, BigDecimal amount, TransactionKind kind, String comment) {
        return recordTransaction(shiftId, amount, kind, comment, null);
    }

    /**
     * Same as {@link #recordTransaction(UUID, BigDecimal, TransactionKind, String)} with an
     * idempotency key stored alongside the entry. The key column is unique, so a
     * concurrent duplicate fails with a {@link org.springframework.dao.DuplicateKeyException}.
     */
    @Transactional
    public CashTransaction recordTransaction(UUID shiftId, BigDecimal amount, TransactionKind kind,
                                             String comment, String idempotencyKey) {
        CashAmounts.requirePositive(amount, "amount");
        if (kind == null) {
            throw new IllegalArgumentException("Transaction kind is required");
        }

        ShiftEntity shift = shiftRepository.findByIdForUpdate(shiftId)
            .orElseThrow(() -> new ShiftNotFoundException(shiftId));
        if (shift.isClosed()) {
            throw new ShiftClosedException(shiftId);
        }

        return append(shiftId, amount, kind, comment, idempotencyKey);
    }

    /**
     * Appends an entry to a shift the caller has already locked and checked.
     * Must run inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CashTransaction appendToLockedShift(UUID shiftId, BigDecimal amount, TransactionKind kind, String comment) {
        CashAmounts.requirePositive(amount, "amount");
        return append(shiftId, amount, kind, comment, null);
    }

    private CashTransaction append(UUID shiftId, BigDecimal amount, TransactionKind kind,
                                   String comment, String idempotencyKey) {
        UUID transactionId = UUID.randomUUID();
        Instant createdAt = Instant.now();

        jdbcTemplate.update(
            "INSERT INTO cash_transactions (id, shift_id, amount, kind, comment, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            transactionId, shiftId, amount, kind.name(), comment, idempotencyKey, Timestamp.from(createdAt)
        );

        metrics.recordTransaction(kind.name());
        log.info("Recorded cash transaction: id={}, kind={}, amount={}", transactionId, kind, amount);

        return findById(transactionId)
            .orElseThrow(() -> new IllegalStateException("Cash transaction " + transactionId + " vanished after insert"));
    }

    @Transactional(readOnly = true)
    public Optional<CashTransaction> findById(UUID transactionId) {
        List<CashTransaction> rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", ROW_MAPPER, transactionId);
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<CashTransaction> findByIdempotencyKey(String idempotencyKey) {
        List<CashTransaction> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE idempotency_key = ?", ROW_MAPPER, idempotencyKey);
        return rows.stream().findFirst();
    }

    /**
     * Entries of a shift in append order.
     *
     * @throws ShiftNotFoundException if the shift does not exist
     */
    @Transactional(readOnly = true)
    public List<CashTransaction> listTransactions(UUID shiftId) {
        if (!shiftRepository.existsById(shiftId)) {
            throw new ShiftNotFoundException(shiftId);
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE shift_id = ? ORDER BY sequence_number ASC", ROW_MAPPER, shiftId);
    }
}
