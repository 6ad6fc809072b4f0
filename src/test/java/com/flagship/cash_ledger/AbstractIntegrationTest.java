package com.flagship.cash_ledger;

import com.flagship.cash_ledger.order.PaymentMethod;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Base for tests against a real PostgreSQL.
 *
 * One container is shared by every test class, so the cached Spring context
 * never points at a stopped database. Tables are truncated before each test;
 * TRUNCATE bypasses the row triggers that make the cash log append-only.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("cash_ledger_test")
            .withUsername("test")
            .withPassword("test");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.execute("TRUNCATE cash_transactions, orders, cash_shifts, employees, "
                + "outbox_events, processed_events RESTART IDENTITY CASCADE");
    }

    protected Long createEmployee(String fullName) {
        return createEmployee(fullName, BigDecimal.ZERO);
    }

    protected Long createEmployee(String fullName, BigDecimal cashBalance) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO employees (full_name, cash_balance) VALUES (?, ?) RETURNING id",
                Long.class, fullName, cashBalance);
    }

    protected Long createOrder(PaymentMethod method, String total) {
        return createOrder(method, total, null, null);
    }

    protected Long createOrder(PaymentMethod method, String total, Long courierId, Long waiterId) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO orders (payment_method, total_price, courier_id, waiter_id) VALUES (?, ?, ?, ?) RETURNING id",
                Long.class, method.name(), new BigDecimal(total), courierId, waiterId);
    }

    /**
     * A cash order already turned in and attributed to {@code shiftId}.
     */
    protected Long createSettledCashOrder(String total, UUID shiftId) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO orders (payment_method, total_price, is_cash_turned_in, cash_shift_id) "
                        + "VALUES ('CASH', ?, TRUE, ?) RETURNING id",
                Long.class, new BigDecimal(total), shiftId);
    }

    protected BigDecimal balanceOf(Long employeeId) {
        return jdbcTemplate.queryForObject(
                "SELECT cash_balance FROM employees WHERE id = ?", BigDecimal.class, employeeId);
    }

    protected boolean isTurnedIn(Long orderId) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(
                "SELECT is_cash_turned_in FROM orders WHERE id = ?", Boolean.class, orderId));
    }

    protected UUID linkedShiftOf(Long orderId) {
        return jdbcTemplate.queryForObject(
                "SELECT cash_shift_id FROM orders WHERE id = ?", UUID.class, orderId);
    }

    protected int countTransactions(UUID shiftId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM cash_transactions WHERE shift_id = ?", Integer.class, shiftId);
        return count != null ? count : 0;
    }

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }
}
