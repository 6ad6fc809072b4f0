package com.flagship.cash_ledger.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The payment-related columns of an order.
 *
 * Orders belong to the order subsystem. The ledger reads payment method and
 * total, and writes only the turned-in flag and the shift link. The link is
 * set at most once; a database trigger rejects re-assignment.
 */
@Entity
@Table(name = "orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "is_cash_turned_in", nullable = false)
    private boolean cashTurnedIn;

    @Column(name = "cash_shift_id")
    private UUID cashShiftId;

    @Column(name = "courier_id", updatable = false)
    private Long courierId;

    @Column(name = "waiter_id", updatable = false)
    private Long waiterId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isCash() {
        return paymentMethod == PaymentMethod.CASH;
    }

    public boolean isLinked() {
        return cashShiftId != null;
    }

    /**
     * Attributes this order to a shift unless it already is.
     *
     * @return true if the link was set by this call
     */
    public boolean linkToShift(UUID shiftId) {
        if (this.cashShiftId != null) {
            return false;
        }
        this.cashShiftId = shiftId;
        return true;
    }

    public void markCashTurnedIn() {
        this.cashTurnedIn = true;
    }

    public void markCashOutstanding() {
        this.cashTurnedIn = false;
    }

    public Order toDomain() {
        return new Order(id, paymentMethod, totalPrice, cashTurnedIn, cashShiftId, courierId, waiterId, createdAt);
    }
}
