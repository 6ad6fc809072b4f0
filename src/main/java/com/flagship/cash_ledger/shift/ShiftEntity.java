package com.flagship.cash_ledger.shift;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the cash_shifts table.
 *
 * No setters: a shift is created through {@link #open} and finalized through
 * {@link #close}. The database adds two guarantees on top:
 * a partial unique index allows one open shift per employee, and a trigger
 * rejects any update of a row that is already closed.
 */
@Entity
@Table(
    name = "cash_shifts",
    indexes = {
        @Index(name = "idx_cash_shifts_open", columnList = "closed, start_time")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ShiftEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private Long employeeId;

    @Column(name = "start_time", nullable = false, updatable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "start_cash", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal startCash;

    @Column(name = "end_cash_actual", precision = 19, scale = 2)
    private BigDecimal endCashActual;

    @Column(nullable = false)
    private boolean closed;

    @Column(name = "total_sales_cash", precision = 19, scale = 2)
    private BigDecimal totalSalesCash;

    @Column(name = "total_sales_card", precision = 19, scale = 2)
    private BigDecimal totalSalesCard;

    @Column(name = "service_in", precision = 19, scale = 2)
    private BigDecimal serviceIn;

    @Column(name = "service_out", precision = 19, scale = 2)
    private BigDecimal serviceOut;

    @Column(name = "theoretical_cash", precision = 19, scale = 2)
    private BigDecimal theoreticalCash;

    private ShiftEntity(UUID id, Long employeeId, Instant startTime, BigDecimal startCash) {
        this.id = id;
        this.employeeId = employeeId;
        this.startTime = startTime;
        this.startCash = startCash;
        this.closed = false;
    }

    static ShiftEntity open(Long employeeId, BigDecimal startCash, Instant startTime) {
        return new ShiftEntity(UUID.randomUUID(), employeeId, startTime, startCash);
    }

    /**
     * Freezes the Z-report totals and moves the shift to its terminal state.
     *
     * @throws IllegalStateException if the shift is already closed
     */
    void close(ShiftTotals totals, BigDecimal endCashActual, Instant endTime) {
        if (this.closed) {
            throw new IllegalStateException("Cash shift " + id + " is already closed");
        }
        this.totalSalesCash = totals.getSalesCash();
        this.totalSalesCard = totals.getSalesCard();
        this.serviceIn = totals.getServiceIn();
        this.serviceOut = totals.getServiceOut();
        this.theoreticalCash = totals.getTheoreticalCash();
        this.endCashActual = endCashActual;
        this.endTime = endTime;
        this.closed = true;
    }

    public Shift toDomain() {
        ShiftTotals totals = closed
            ? new ShiftTotals(totalSalesCash, totalSalesCard, serviceIn, serviceOut, theoreticalCash)
            : null;
        return new Shift(id, employeeId, startTime, endTime, startCash, endCashActual, closed, totals);
    }
}
