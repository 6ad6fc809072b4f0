package com.flagship.cash_ledger.statistics;

import com.flagship.cash_ledger.ledger.CashAmounts;
import com.flagship.cash_ledger.ledger.TransactionKind;
import com.flagship.cash_ledger.order.PaymentMethod;
import com.flagship.cash_ledger.shift.Shift;
import com.flagship.cash_ledger.shift.ShiftTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * X-report (open shift) or Z-report (closed shift) figures.
 *
 * Sales and collected cash are different quantities. Sales count every order
 * attributed to the shift, whether or not its cash reached the drawer.
 * Collected cash counts only cash orders that are turned in, which covers
 * orders settled at the counter and orders settled through a handover.
 * {@code handoverIn} is informational and is not part of the drawer formula,
 * since handed-over orders are already in {@code collectedCashOrders}.
 */
@Value
@Builder
public class ShiftStatistics {
    UUID shiftId;
    Long employeeId;
    Instant startTime;
    BigDecimal startCash;
    BigDecimal salesCash;
    BigDecimal salesCard;
    BigDecimal totalSales;
    BigDecimal serviceIn;
    BigDecimal serviceOut;
    BigDecimal handoverIn;
    BigDecimal collectedCashOrders;
    BigDecimal theoreticalCash;
    boolean closed;

    /**
     * Builds the report from raw sums.
     *
     * @param salesByMethod order totals attributed to the shift, per payment method
     * @param transactionsByKind transaction totals of the shift, per kind
     * @param collectedCashOrders totals of turned-in cash orders attributed to the shift
     */
    public static ShiftStatistics compute(Shift shift,
                                          Map<PaymentMethod, BigDecimal> salesByMethod,
                                          Map<TransactionKind, BigDecimal> transactionsByKind,
                                          BigDecimal collectedCashOrders) {
        Map<Column, BigDecimal> columns = new EnumMap<>(Column.class);
        salesByMethod.forEach((method, total) -> columns.merge(columnOf(method), total, BigDecimal::add));
        transactionsByKind.forEach((kind, total) -> columns.merge(columnOf(kind), total, BigDecimal::add));

        BigDecimal salesCash = columns.getOrDefault(Column.SALES_CASH, BigDecimal.ZERO);
        BigDecimal salesCard = columns.getOrDefault(Column.SALES_CARD, BigDecimal.ZERO);
        BigDecimal serviceIn = columns.getOrDefault(Column.SERVICE_IN, BigDecimal.ZERO);
        BigDecimal serviceOut = columns.getOrDefault(Column.SERVICE_OUT, BigDecimal.ZERO);
        BigDecimal handoverIn = columns.getOrDefault(Column.HANDOVER_IN, BigDecimal.ZERO);

        BigDecimal collected = collectedCashOrders != null ? collectedCashOrders : BigDecimal.ZERO;
        BigDecimal theoreticalCash = shift.getStartCash()
            .add(collected)
            .add(serviceIn)
            .subtract(serviceOut);

        return ShiftStatistics.builder()
            .shiftId(shift.getId())
            .employeeId(shift.getEmployeeId())
            .startTime(shift.getStartTime())
            .startCash(money(shift.getStartCash()))
            .salesCash(money(salesCash))
            .salesCard(money(salesCard))
            .totalSales(money(salesCash.add(salesCard)))
            .serviceIn(money(serviceIn))
            .serviceOut(money(serviceOut))
            .handoverIn(money(handoverIn))
            .collectedCashOrders(money(collected))
            .theoreticalCash(money(theoreticalCash))
            .closed(shift.isClosed())
            .build();
    }

    /**
     * The figures frozen onto a shift when it closes.
     */
    public ShiftTotals toTotals() {
        return new ShiftTotals(salesCash, salesCard, serviceIn, serviceOut, theoreticalCash);
    }

    private enum Column {
        SALES_CASH,
        SALES_CARD,
        SERVICE_IN,
        SERVICE_OUT,
        HANDOVER_IN
    }

    private static Column columnOf(PaymentMethod method) {
        return switch (method) {
            case CASH -> Column.SALES_CASH;
            case CARD -> Column.SALES_CARD;
        };
    }

    private static Column columnOf(TransactionKind kind) {
        return switch (kind) {
            case MANUAL_IN -> Column.SERVICE_IN;
            case MANUAL_OUT -> Column.SERVICE_OUT;
            case HANDOVER_IN -> Column.HANDOVER_IN;
        };
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(CashAmounts.SCALE, RoundingMode.UNNECESSARY);
    }
}
