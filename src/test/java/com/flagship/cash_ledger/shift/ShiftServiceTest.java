package com.flagship.cash_ledger.shift;

import com.flagship.cash_ledger.AbstractIntegrationTest;
import com.flagship.cash_ledger.event.ShiftClosedEvent;
import com.flagship.cash_ledger.event.ShiftOpenedEvent;
import com.flagship.cash_ledger.exception.EmployeeNotFoundException;
import com.flagship.cash_ledger.exception.InvalidAmountException;
import com.flagship.cash_ledger.exception.ShiftAlreadyClosedException;
import com.flagship.cash_ledger.exception.ShiftAlreadyOpenException;
import com.flagship.cash_ledger.exception.ShiftNotFoundException;
import com.flagship.cash_ledger.ledger.CashTransactionService;
import com.flagship.cash_ledger.ledger.TransactionKind;
import com.flagship.cash_ledger.outbox.OutboxEvent;
import com.flagship.cash_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shift lifecycle against PostgreSQL: one open shift per employee, one-way
 * close, frozen Z-report totals.
 */
class ShiftServiceTest extends AbstractIntegrationTest {

    @Autowired
    private ShiftService shiftService;

    @Autowired
    private CashTransactionService transactionService;

    @Autowired
    private OutboxService outboxService;

    private Long cashierId;

    @BeforeEach
    void setUp() {
        cashierId = createEmployee("Olena Cashier");
        printInput("Cashier ID", cashierId);
    }

    @Test
    @DisplayName("Open shift creates an open shift and a ShiftOpened event")
    void testOpenShift_CreatesOpenShift() {
        printTestHeader("Open Shift");

        Shift shift = shiftService.openShift(cashierId, new BigDecimal("500.00"));
        printOutput("Shift", shift);

        assertNotNull(shift.getId());
        assertTrue(shift.isOpen());
        assertEquals(cashierId, shift.getEmployeeId());
        assertEquals(0, new BigDecimal("500.00").compareTo(shift.getStartCash()));
        assertNotNull(shift.getStartTime());
        assertNull(shift.getEndTime());
        assertNull(shift.getTotals());

        assertEquals(shift.getId(), shiftService.getOpenShift(cashierId).orElseThrow().getId());

        List<OutboxEvent> events = outboxService.getEventsForShift(shift.getId());
        assertEquals(1, events.size());
        assertEquals(ShiftOpenedEvent.EVENT_TYPE, events.get(0).getEventType());

        printSuccess("Shift opened and event written to outbox");
    }

    @Test
    @DisplayName("Opening a second shift for the same employee fails with 'already open'")
    void testOpenShift_AlreadyOpen() {
        printTestHeader("Open Shift Twice");

        shiftService.openShift(cashierId, new BigDecimal("100.00"));

        assertThrows(ShiftAlreadyOpenException.class,
                () -> shiftService.openShift(cashierId, new BigDecimal("200.00")));
        assertEquals(1, shiftService.listShifts(cashierId).size());

        printExpectedException("ShiftAlreadyOpenException", "employee already has an open shift");
    }

    @Test
    @DisplayName("Employee can open a new shift after closing the previous one")
    void testOpenShift_AfterClose() {
        printTestHeader("Open After Close");

        Shift first = shiftService.openShift(cashierId, new BigDecimal("100.00"));
        shiftService.closeShift(first.getId(), new BigDecimal("100.00"));

        Shift second = shiftService.openShift(cashierId, new BigDecimal("50.00"));

        assertNotEquals(first.getId(), second.getId());
        List<Shift> history = shiftService.listShifts(cashierId);
        assertEquals(2, history.size());
        assertEquals(1, history.stream().filter(Shift::isOpen).count());

        printSuccess("Only the new shift is open");
    }

    @Test
    @DisplayName("Open shift rejects negative or over-precise start cash and unknown employees")
    void testOpenShift_Validation() {
        printTestHeader("Open Shift Validation");

        assertThrows(InvalidAmountException.class,
                () -> shiftService.openShift(cashierId, new BigDecimal("-1.00")));
        assertThrows(InvalidAmountException.class,
                () -> shiftService.openShift(cashierId, new BigDecimal("10.001")));
        assertThrows(InvalidAmountException.class,
                () -> shiftService.openShift(cashierId, null));
        assertThrows(EmployeeNotFoundException.class,
                () -> shiftService.openShift(999_999L, BigDecimal.ZERO));

        assertTrue(shiftService.getOpenShift(cashierId).isEmpty());
        printSuccess("Invalid requests rejected before any mutation");
    }

    @Test
    @DisplayName("Concurrent opens for the same employee: exactly one succeeds")
    void testOpenShift_ConcurrentOpens() throws InterruptedException {
        printTestHeader("Concurrent Open Shift");

        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger alreadyOpenCount = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    shiftService.openShift(cashierId, new BigDecimal("100.00"));
                    successCount.incrementAndGet();
                } catch (ShiftAlreadyOpenException e) {
                    alreadyOpenCount.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Successes", successCount.get());
        printOutput("Already open", alreadyOpenCount.get());

        assertEquals(1, successCount.get());
        assertEquals(threadCount - 1, alreadyOpenCount.get());
        Integer open = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cash_shifts WHERE employee_id = ? AND closed = FALSE", Integer.class, cashierId);
        assertEquals(1, open);

        printSuccess("Only one shift opened");
    }

    @Test
    @DisplayName("Close shift freezes totals and exposes the discrepancy")
    void testCloseShift_FreezesTotals() {
        printTestHeader("Close Shift");

        Shift shift = shiftService.openShift(cashierId, new BigDecimal("500.00"));
        createSettledCashOrder("200.00", shift.getId());
        transactionService.recordTransaction(shift.getId(), new BigDecimal("50.00"), TransactionKind.MANUAL_OUT, "supplies");

        Shift closed = shiftService.closeShift(shift.getId(), new BigDecimal("640.00"));
        printOutput("Closed shift", closed);

        assertTrue(closed.isClosed());
        assertNotNull(closed.getEndTime());
        assertEquals(0, new BigDecimal("650.00").compareTo(closed.getTotals().getTheoreticalCash()));
        assertEquals(0, new BigDecimal("200.00").compareTo(closed.getTotals().getSalesCash()));
        assertEquals(0, BigDecimal.ZERO.compareTo(closed.getTotals().getSalesCard()));
        assertEquals(0, new BigDecimal("50.00").compareTo(closed.getTotals().getServiceOut()));
        assertEquals(0, new BigDecimal("-10.00").compareTo(closed.getDiscrepancy()));

        assertTrue(shiftService.getOpenShift(cashierId).isEmpty());
        List<OutboxEvent> events = outboxService.getEventsForShift(shift.getId());
        assertEquals(ShiftClosedEvent.EVENT_TYPE, events.get(events.size() - 1).getEventType());

        printSuccess("Z-report totals frozen");
    }

    @Test
    @DisplayName("Closing twice fails and leaves the first totals unchanged")
    void testCloseShift_Twice() {
        printTestHeader("Close Shift Twice");

        Shift shift = shiftService.openShift(cashierId, new BigDecimal("100.00"));
        Shift first = shiftService.closeShift(shift.getId(), new BigDecimal("100.00"));

        assertThrows(ShiftAlreadyClosedException.class,
                () -> shiftService.closeShift(shift.getId(), new BigDecimal("999.00")));

        Shift reloaded = shiftService.getShift(shift.getId());
        assertEquals(0, first.getTotals().getTheoreticalCash().compareTo(reloaded.getTotals().getTheoreticalCash()));
        assertEquals(0, new BigDecimal("100.00").compareTo(reloaded.getEndCashActual()));
        assertTrue(reloaded.isClosed());

        printExpectedException("ShiftAlreadyClosedException", "second close");
    }

    @Test
    @DisplayName("Database rejects any update of a closed shift")
    void testClosedShift_ImmutableInDatabase() {
        printTestHeader("Closed Shift Immutable");

        Shift shift = shiftService.openShift(cashierId, new BigDecimal("100.00"));
        shiftService.closeShift(shift.getId(), new BigDecimal("100.00"));

        assertThrows(Exception.class, () -> jdbcTemplate.update(
                "UPDATE cash_shifts SET end_cash_actual = 0 WHERE id = ?", shift.getId()));

        printSuccess("Trigger rejected the update");
    }

    @Test
    @DisplayName("Unknown shift ids fail with not found")
    void testShiftNotFound() {
        UUID unknown = UUID.randomUUID();
        assertThrows(ShiftNotFoundException.class, () -> shiftService.getShift(unknown));
        assertThrows(ShiftNotFoundException.class, () -> shiftService.closeShift(unknown, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Any open shift falls back to the most recently opened one")
    void testGetAnyOpenShift_MostRecent() throws InterruptedException {
        printTestHeader("Get Any Open Shift");

        assertTrue(shiftService.getAnyOpenShift().isEmpty());

        Long otherCashier = createEmployee("Petro Cashier");
        shiftService.openShift(cashierId, new BigDecimal("10.00"));
        Thread.sleep(20);
        Shift newer = shiftService.openShift(otherCashier, new BigDecimal("20.00"));

        assertEquals(newer.getId(), shiftService.getAnyOpenShift().orElseThrow().getId());
        printSuccess("Most recent open shift returned");
    }
}
