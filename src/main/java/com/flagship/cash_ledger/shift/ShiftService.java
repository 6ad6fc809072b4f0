package com.flagship.cash_ledger.shift;

import com.flagship.cash_ledger.employee.EmployeeRepository;
import com.flagship.cash_ledger.event.ShiftClosedEvent;
import com.flagship.cash_ledger.event.ShiftOpenedEvent;
import com.flagship.cash_ledger.exception.EmployeeNotFoundException;
import com.flagship.cash_ledger.exception.ShiftAlreadyClosedException;
import com.flagship.cash_ledger.exception.ShiftAlreadyOpenException;
import com.flagship.cash_ledger.exception.ShiftNotFoundException;
import com.flagship.cash_ledger.ledger.CashAmounts;
import com.flagship.cash_ledger.observability.CorrelationContext;
import com.flagship.cash_ledger.observability.LedgerMetrics;
import com.flagship.cash_ledger.outbox.OutboxService;
import com.flagship.cash_ledger.statistics.ShiftStatistics;
import com.flagship.cash_ledger.statistics.ShiftStatisticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lifecycle of cash-register shifts: OPEN → CLOSED, one way.
 *
 * Opening is serialized per employee by a row lock on the employee, and the
 * partial unique index on open shifts catches anything that slips past it.
 * Closing locks the shift row, so it cannot interleave with appends, order
 * links or handovers targeting the same shift.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ShiftService {

    private final ShiftRepository shiftRepository;
    private final EmployeeRepository employeeRepository;
    private final ShiftStatisticsService statisticsService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;

    /**
     * Opens a shift for an employee.
     *
     * @throws com.flagship.cash_ledger.exception.InvalidAmountException if startCash is negative or malformed
     * @throws EmployeeNotFoundException if the employee does not exist
     * @throws ShiftAlreadyOpenException if the employee already has an open shift
     */
    @Transactional
    public Shift openShift(Long employeeId, BigDecimal startCash) {
        CashAmounts.requireNonNegative(startCash, "startCash");

        CorrelationContext.setEmployeeId(employeeId);
        try {
            employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> new EmployeeNotFoundException(employeeId));

            if (shiftRepository.findFirstByEmployeeIdAndClosedFalse(employeeId).isPresent()) {
                throw new ShiftAlreadyOpenException(employeeId);
            }

            ShiftEntity saved;
            try {
                saved = shiftRepository.saveAndFlush(ShiftEntity.open(employeeId, startCash, Instant.now()));
            } catch (DataIntegrityViolationException e) {
                log.warn("Open shift rejected by unique index for employee {}", employeeId);
                throw new ShiftAlreadyOpenException(employeeId);
            }

            Shift shift = saved.toDomain();
            outboxService.saveEvent(ShiftOpenedEvent.fromShift(shift));
            metrics.recordShiftOpened();

            log.info("Opened cash shift {} with start cash {}", shift.getId(), startCash);
            return shift;
        } finally {
            CorrelationContext.clearEmployeeId();
        }
    }

    @Transactional(readOnly = true)
    public Optional<Shift> getOpenShift(Long employeeId) {
        return shiftRepository.findFirstByEmployeeIdAndClosedFalse(employeeId).map(ShiftEntity::toDomain);
    }

    /**
     * Most recently opened shift of any employee. Used as attribution fallback.
     */
    @Transactional(readOnly = true)
    public Optional<Shift> getAnyOpenShift() {
        return shiftRepository.findFirstByClosedFalseOrderByStartTimeDesc().map(ShiftEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Shift getShift(UUID shiftId) {
        return shiftRepository.findById(shiftId)
            .map(ShiftEntity::toDomain)
            .orElseThrow(() -> new ShiftNotFoundException(shiftId));
    }

    /**
     * Shift history, newest first. A null employee id lists every shift.
     */
    @Transactional(readOnly = true)
    public List<Shift> listShifts(Long employeeId) {
        List<ShiftEntity> entities = employeeId != null
            ? shiftRepository.findByEmployeeIdOrderByStartTimeDesc(employeeId)
            : shiftRepository.findAllByOrderByStartTimeDesc();
        return entities.stream().map(ShiftEntity::toDomain).toList();
    }

    /**
     * Closes a shift, freezing its Z-report totals.
     *
     * @throws com.flagship.cash_ledger.exception.InvalidAmountException if endCashActual is negative or malformed
     * @throws ShiftNotFoundException if the shift does not exist
     * @throws ShiftAlreadyClosedException if the shift is already closed
     */
    @Transactional
    public Shift closeShift(UUID shiftId, BigDecimal endCashActual) {
        CashAmounts.requireNonNegative(endCashActual, "endCashActual");

        CorrelationContext.setShiftId(shiftId);
        try {
            ShiftEntity entity = shiftRepository.findByIdForUpdate(shiftId)
                .orElseThrow(() -> new ShiftNotFoundException(shiftId));
            if (entity.isClosed()) {
                throw new ShiftAlreadyClosedException(shiftId);
            }

            ShiftStatistics statistics = statisticsService.computeStatistics(entity.toDomain());
            entity.close(statistics.toTotals(), endCashActual, Instant.now());
            ShiftEntity saved = shiftRepository.saveAndFlush(entity);

            Shift shift = saved.toDomain();
            outboxService.saveEvent(ShiftClosedEvent.fromShift(shift));
            metrics.recordShiftClosed(shift.getDiscrepancy());

            log.info("Closed cash shift: theoreticalCash={}, endCashActual={}, discrepancy={}",
                shift.getTotals().getTheoreticalCash(), endCashActual, shift.getDiscrepancy());
            return shift;
        } finally {
            CorrelationContext.clearShiftId();
        }
    }

    /**
     * Locks the shift an order should be attributed to: the preferred
     * employee's open shift, else the most recently opened one. Must run inside
     * the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<ShiftEntity> lockAttributionTarget(Long preferredEmployeeId) {
        if (preferredEmployeeId != null) {
            Optional<ShiftEntity> own = shiftRepository.findOpenByEmployeeIdForUpdate(preferredEmployeeId);
            if (own.isPresent()) {
                return own;
            }
        }
        return shiftRepository.findLatestOpenForUpdate(PageRequest.of(0, 1)).stream().findFirst();
    }
}
