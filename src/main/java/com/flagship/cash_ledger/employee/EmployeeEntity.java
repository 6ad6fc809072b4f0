package com.flagship.cash_ledger.employee;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for the employees table.
 *
 * Employees are created by the staff subsystem; the ledger only moves
 * {@code cash_balance}. The balance never goes below zero: decreases are
 * clamped here and the table carries a CHECK constraint.
 */
@Entity
@Table(name = "employees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EmployeeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(name = "full_name", nullable = false, updatable = false)
    private String fullName;

    @Column(name = "cash_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal cashBalance;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    void increaseCashBalance(BigDecimal amount) {
        this.cashBalance = currentBalance().add(amount);
    }

    /**
     * Decreases the balance by {@code amount}, stopping at zero.
     *
     * @return the amount actually removed from the balance
     */
    public BigDecimal decreaseCashBalance(BigDecimal amount) {
        BigDecimal current = currentBalance();
        BigDecimal remaining = current.subtract(amount);
        if (remaining.signum() < 0) {
            this.cashBalance = BigDecimal.ZERO;
            return current;
        }
        this.cashBalance = remaining;
        return amount;
    }

    private BigDecimal currentBalance() {
        return cashBalance != null ? cashBalance : BigDecimal.ZERO;
    }

    public Employee toDomain() {
        return new Employee(id, fullName, currentBalance());
    }
}
