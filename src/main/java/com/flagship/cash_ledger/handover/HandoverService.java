package com.flagship.cash_ledger.handover;

import com.flagship.cash_ledger.employee.EmployeeEntity;
import com.flagship.cash_ledger.employee.EmployeeRepository;
import com.flagship.cash_ledger.event.CashHandedOverEvent;
import com.flagship.cash_ledger.exception.EmployeeNotFoundException;
import com.flagship.cash_ledger.exception.NoEligibleOrdersException;
import com.flagship.cash_ledger.exception.ShiftClosedException;
import com.flagship.cash_ledger.exception.ShiftNotFoundException;
import com.flagship.cash_ledger.ledger.CashTransaction;
import com.flagship.cash_ledger.ledger.CashTransactionService;
import com.flagship.cash_ledger.ledger.TransactionKind;
import com.flagship.cash_ledger.observability.CorrelationContext;
import com.flagship.cash_ledger.observability.LedgerMetrics;
import com.flagship.cash_ledger.order.OrderEntity;
import com.flagship.cash_ledger.order.OrderRepository;
import com.flagship.cash_ledger.outbox.OutboxService;
import com.flagship.cash_ledger.shift.ShiftEntity;
import com.flagship.cash_ledger.shift.ShiftRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Moves cash an employee collected into a cashier's shift.
 *
 * One transaction, locks taken in the order shift, employee, orders:
 * <ol>
 *   <li>lock the cashier's shift and require it to be open</li>
 *   <li>lock the employee</li>
 *   <li>lock the requested cash orders still awaiting handover; other ids are ignored</li>
 *   <li>mark them turned in, linking unlinked ones to the cashier's shift</li>
 *   <li>decrease the employee's balance by their total, stopping at zero</li>
 *   <li>append one HANDOVER_IN entry for the total</li>
 * </ol>
 * Any failure rolls back every step.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HandoverService {

    private final ShiftRepository shiftRepository;
    private final EmployeeRepository employeeRepository;
    private final OrderRepository orderRepository;
    private final CashTransactionService transactionService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Settles the listed orders of one employee into the cashier's shift.
     *
     * Flow:
     * 1. Lock the shift, reject it if closed
     * 2. Lock the employee, then the eligible orders
     * 3. Mark the orders turned in and link the unlinked ones
     * 4. Decrease the balance, append HANDOVER_IN, write the outbox event
     *
     * A zero total settles the orders without a log entry, so the result's
     * transaction id is null.
     *
     * @param cashierShiftId shift receiving the cash
     * @param employeeId courier or waiter handing over
     * @param orderIds requested orders; ineligible and duplicate ids are ignored
     * @return the amount moved, the settled orders and the remaining balance
     * @throws ShiftNotFoundException if the cashier's shift does not exist
     * @throws ShiftClosedException if the cashier's shift is closed
     * @throws EmployeeNotFoundException if the employee does not exist
     * @throws NoEligibleOrdersException if none of the orders is a cash order awaiting handover
     */
    @Transactional
    public HandoverResult processHandover(UUID cashierShiftId, Long employeeId, List<Long> orderIds) {
        if (orderIds == null) {
            throw new IllegalArgumentException("Order ids are required");
        }
        long startTime = System.currentTimeMillis();
        CorrelationContext.setShiftId(cashierShiftId);
        CorrelationContext.setEmployeeId(employeeId);
        try {
            ShiftEntity shift = shiftRepository.findByIdForUpdate(cashierShiftId)
                .orElseThrow(() -> new ShiftNotFoundException(cashierShiftId));
            if (shift.isClosed()) {
                throw new ShiftClosedException(cashierShiftId);
            }

            EmployeeEntity employee = employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> new EmployeeNotFoundException(employeeId));

            List<OrderEntity> orders = orderIds.isEmpty()
                ? List.of()
                : orderRepository.findAwaitingHandoverForUpdate(new LinkedHashSet<>(orderIds));
            if (orders.isEmpty()) {
                throw new NoEligibleOrdersException(orderIds);
            }

            BigDecimal amount = BigDecimal.ZERO;
            for (OrderEntity order : orders) {
                amount = amount.add(order.getTotalPrice());
                order.markCashTurnedIn();
                if (order.linkToShift(cashierShiftId)) {
                    log.debug("Order {} linked to shift {} at handover", order.getId(), cashierShiftId);
                }
            }
            orderRepository.saveAll(orders);

            BigDecimal removed = employee.decreaseCashBalance(amount);
            if (removed.compareTo(amount) < 0) {
                log.warn("Handover of {} exceeds balance, balance clamped to zero after removing {}", amount, removed);
            }
            employeeRepository.save(employee);

            List<Long> settledIds = orders.stream().map(OrderEntity::getId).toList();
            UUID transactionId = null;
            if (amount.signum() > 0) {
                CashTransaction transaction = transactionService.appendToLockedShift(
                    cashierShiftId, amount, TransactionKind.HANDOVER_IN, comment(employee, settledIds));
                transactionId = transaction.getId();
            }

            outboxService.saveEvent(CashHandedOverEvent.of(
                cashierShiftId, transactionId, employeeId, amount, settledIds, employee.getCashBalance()));

            metrics.recordHandover(amount);
            metrics.recordLatency("handover", System.currentTimeMillis() - startTime);
            log.info("Handover accepted: amount={}, orders={}, remainingBalance={}",
                amount, settledIds, employee.getCashBalance());

            return new HandoverResult(cashierShiftId, employeeId, transactionId, amount, settledIds,
                employee.getCashBalance());
        } finally {
            CorrelationContext.clearShiftId();
            CorrelationContext.clearEmployeeId();
        }
    }

    private static String comment(EmployeeEntity employee, List<Long> orderIds) {
        return "Handover from " + employee.getFullName() + " (employee " + employee.getId() + ") for orders "
            + orderIds.stream().map(id -> "#" + id).collect(Collectors.joining(", "));
    }
}
