package com.flagship.cash_ledger.statistics;

import com.flagship.cash_ledger.exception.ShiftNotFoundException;
import com.flagship.cash_ledger.ledger.TransactionKind;
import com.flagship.cash_ledger.order.PaymentMethod;
import com.flagship.cash_ledger.shift.Shift;
import com.flagship.cash_ledger.shift.ShiftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Computes shift statistics from the orders attributed to a shift and its
 * cash log. Read-only: an open shift gets an X-report, and
 * {@link com.flagship.cash_ledger.shift.ShiftService#closeShift} calls
 * {@link #computeStatistics(Shift)} under the shift lock to freeze the Z-report.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ShiftStatisticsService {

    private final JdbcTemplate jdbcTemplate;
    private final ShiftRepository shiftRepository;

    /**
     * @throws ShiftNotFoundException if the shift does not exist
     */
    @Transactional(readOnly = true)
    public ShiftStatistics computeStatistics(UUID shiftId) {
        Shift shift = shiftRepository.findById(shiftId)
            .orElseThrow(() -> new ShiftNotFoundException(shiftId))
            .toDomain();
        return computeStatistics(shift);
    }

    @Transactional(readOnly = true)
    public ShiftStatistics computeStatistics(Shift shift) {
        UUID shiftId = shift.getId();

        Map<PaymentMethod, BigDecimal> salesByMethod = new EnumMap<>(PaymentMethod.class);
        jdbcTemplate.query(
            "SELECT payment_method, SUM(total_price) AS total FROM orders " +
            "WHERE cash_shift_id = ? GROUP BY payment_method",
            (RowCallbackHandler) rs -> {
                salesByMethod.put(PaymentMethod.valueOf(rs.getString("payment_method")), rs.getBigDecimal("total"));
            },
            shiftId);

        Map<TransactionKind, BigDecimal> transactionsByKind = new EnumMap<>(TransactionKind.class);
        jdbcTemplate.query(
            "SELECT kind, SUM(amount) AS total FROM cash_transactions WHERE shift_id = ? GROUP BY kind",
            (RowCallbackHandler) rs -> {
                transactionsByKind.put(TransactionKind.valueOf(rs.getString("kind")), rs.getBigDecimal("total"));
            },
            shiftId);

        BigDecimal collectedCashOrders = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(total_price), 0) FROM orders " +
            "WHERE cash_shift_id = ? AND payment_method = 'CASH' AND is_cash_turned_in = TRUE",
            BigDecimal.class,
            shiftId);

        ShiftStatistics statistics = ShiftStatistics.compute(shift, salesByMethod, transactionsByKind, collectedCashOrders);
        log.debug("Computed statistics for shift {}: theoreticalCash={}, closed={}",
            shiftId, statistics.getTheoreticalCash(), statistics.isClosed());
        return statistics;
    }
}
