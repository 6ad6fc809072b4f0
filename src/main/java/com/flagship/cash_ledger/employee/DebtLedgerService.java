package com.flagship.cash_ledger.employee;

import com.flagship.cash_ledger.exception.EmployeeNotFoundException;
import com.flagship.cash_ledger.exception.OrderNotFoundException;
import com.flagship.cash_ledger.observability.CorrelationContext;
import com.flagship.cash_ledger.observability.LedgerMetrics;
import com.flagship.cash_ledger.order.Order;
import com.flagship.cash_ledger.order.OrderEntity;
import com.flagship.cash_ledger.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Tracks cash employees hold on the business's behalf.
 *
 * A courier or waiter who takes cash for an order owes it until a cashier
 * accepts it in a handover. The debt lives in {@code employees.cash_balance};
 * the orders that make it up are the cash orders with {@code is_cash_turned_in = false}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DebtLedgerService {

    private final EmployeeRepository employeeRepository;
    private final OrderRepository orderRepository;
    private final LedgerMetrics metrics;

    /**
     * Records that {@code employeeId} holds the cash of {@code orderId}.
     *
     * Card orders are ignored. An order whose cash is already outstanding is not
     * counted twice, so redelivered completion events are harmless.
     *
     * @return true if the employee's balance was increased
     * @throws EmployeeNotFoundException if the employee does not exist
     * @throws OrderNotFoundException if the order does not exist
     */
    @Transactional
    public boolean registerDebt(Long orderId, Long employeeId) {
        CorrelationContext.setEmployeeId(employeeId);
        try {
            EmployeeEntity employee = employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> new EmployeeNotFoundException(employeeId));
            OrderEntity order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

            if (!order.isCash()) {
                log.debug("Order {} is not paid in cash, no debt registered", orderId);
                return false;
            }
            if (!order.isCashTurnedIn()) {
                log.info("Cash of order {} is already outstanding, debt not registered again", orderId);
                return false;
            }

            employee.increaseCashBalance(order.getTotalPrice());
            order.markCashOutstanding();
            employeeRepository.save(employee);
            orderRepository.save(order);

            metrics.recordDebtRegistered();
            log.info("Registered debt of {} for order {}, balance now {}",
                order.getTotalPrice(), orderId, employee.getCashBalance());
            return true;
        } finally {
            CorrelationContext.clearEmployeeId();
        }
    }

    @Transactional(readOnly = true)
    public Employee getEmployee(Long employeeId) {
        return employeeRepository.findById(employeeId)
            .map(EmployeeEntity::toDomain)
            .orElseThrow(() -> new EmployeeNotFoundException(employeeId));
    }

    /**
     * Employees currently holding cash, largest balance first.
     */
    @Transactional(readOnly = true)
    public List<Employee> listDebtors() {
        return employeeRepository.findDebtors().stream()
            .map(EmployeeEntity::toDomain)
            .toList();
    }

    /**
     * Cash orders the employee delivered or served whose cash has not reached a drawer.
     *
     * @throws EmployeeNotFoundException if the employee does not exist
     */
    @Transactional(readOnly = true)
    public List<Order> listOutstandingOrders(Long employeeId) {
        if (!employeeRepository.existsById(employeeId)) {
            throw new EmployeeNotFoundException(employeeId);
        }
        return orderRepository.findOutstandingCashOrders(employeeId).stream()
            .map(OrderEntity::toDomain)
            .toList();
    }
}
