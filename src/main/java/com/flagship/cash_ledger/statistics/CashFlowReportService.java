package com.flagship.cash_ledger.statistics;

import com.flagship.cash_ledger.ledger.CashAmounts;
import com.flagship.cash_ledger.ledger.TransactionKind;
import com.flagship.cash_ledger.order.PaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Cash flow over a time range: revenue of shift-attributed orders by payment
 * method, every cash log entry of the range, and total withdrawals.
 */
@Service
@Slf4j
public class CashFlowReportService {

    private static final RowMapper<CashFlowReport.Entry> ENTRY_MAPPER = (rs, rowNum) -> new CashFlowReport.Entry(
        rs.getObject("id", UUID.class),
        rs.getObject("shift_id", UUID.class),
        rs.getString("full_name"),
        TransactionKind.valueOf(rs.getString("kind")),
        rs.getBigDecimal("amount"),
        rs.getString("comment"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public CashFlowReportService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Builds the report for {@code [from, to)}.
     *
     * @throws IllegalArgumentException if the range is empty or reversed
     */
    @Transactional(readOnly = true)
    public CashFlowReport buildReport(Instant from, Instant to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("Report range must satisfy from < to, got " + from + " .. " + to);
        }
        Timestamp fromTs = Timestamp.from(from);
        Timestamp toTs = Timestamp.from(to);

        Map<PaymentMethod, BigDecimal> revenueByMethod = new EnumMap<>(PaymentMethod.class);
        jdbcTemplate.query(
            "SELECT payment_method, SUM(total_price) AS total FROM orders " +
            "WHERE cash_shift_id IS NOT NULL AND created_at >= ? AND created_at < ? " +
            "GROUP BY payment_method",
            (RowCallbackHandler) rs -> {
                revenueByMethod.put(PaymentMethod.valueOf(rs.getString("payment_method")), rs.getBigDecimal("total"));
            },
            fromTs, toTs);

        List<CashFlowReport.Entry> entries = jdbcTemplate.query(
            "SELECT t.id, t.shift_id, e.full_name, t.kind, t.amount, t.comment, t.created_at " +
            "FROM cash_transactions t " +
            "JOIN cash_shifts s ON s.id = t.shift_id " +
            "JOIN employees e ON e.id = s.employee_id " +
            "WHERE t.created_at >= ? AND t.created_at < ? " +
            "ORDER BY t.created_at DESC, t.sequence_number DESC",
            ENTRY_MAPPER, fromTs, toTs);

        BigDecimal expenses = entries.stream()
            .filter(entry -> entry.getKind() == TransactionKind.MANUAL_OUT)
            .map(CashFlowReport.Entry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal cashRevenue = revenueByMethod.getOrDefault(PaymentMethod.CASH, BigDecimal.ZERO);
        BigDecimal cardRevenue = revenueByMethod.getOrDefault(PaymentMethod.CARD, BigDecimal.ZERO);

        log.debug("Built cash flow report for {} .. {}: {} transactions", from, to, entries.size());

        return CashFlowReport.builder()
            .from(from)
            .to(to)
            .cashRevenue(money(cashRevenue))
            .cardRevenue(money(cardRevenue))
            .totalRevenue(money(cashRevenue.add(cardRevenue)))
            .totalExpenses(money(expenses))
            .transactions(entries)
            .build();
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(CashAmounts.SCALE, RoundingMode.UNNECESSARY);
    }
}
