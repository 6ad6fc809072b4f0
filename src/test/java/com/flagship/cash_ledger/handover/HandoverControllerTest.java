package com.flagship.cash_ledger.handover;

import com.flagship.cash_ledger.AbstractIntegrationTest;
import com.flagship.cash_ledger.employee.DebtLedgerService;
import com.flagship.cash_ledger.order.PaymentMethod;
import com.flagship.cash_ledger.shift.Shift;
import com.flagship.cash_ledger.shift.ShiftService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Debt and handover flow over HTTP: who owes what, then the handover itself.
 */
@AutoConfigureMockMvc
class HandoverControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ShiftService shiftService;

    @Autowired
    private DebtLedgerService debtLedgerService;

    private Long courierId;
    private Shift shift;

    @BeforeEach
    void setUp() {
        Long cashierId = createEmployee("Olena Cashier");
        courierId = createEmployee("Ivan Courier");
        shift = shiftService.openShift(cashierId, BigDecimal.ZERO);
    }

    @Test
    @DisplayName("Debtor lists the order, hands it over, and is settled")
    void testHandoverFlow() throws Exception {
        printTestHeader("Handover Over HTTP");

        Long orderId = createOrder(PaymentMethod.CASH, "150.00", courierId, null);
        debtLedgerService.registerDebt(orderId, courierId);

        mockMvc.perform(get("/api/employees/debtors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(courierId))
                .andExpect(jsonPath("$[0].cash_balance").value(150.00));

        mockMvc.perform(get("/api/employees/{employeeId}/outstanding-orders", courierId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].order_id").value(orderId))
                .andExpect(jsonPath("$[0].total_price").value(150.00));

        mockMvc.perform(post("/api/shifts/{shiftId}/handovers", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employee_id\": " + courierId + ", \"order_ids\": [" + orderId + "]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.amount").value(150.00))
                .andExpect(jsonPath("$.settled_order_ids[0]").value(orderId))
                .andExpect(jsonPath("$.remaining_balance").value(0.00))
                .andExpect(jsonPath("$.transaction_id").exists());

        mockMvc.perform(get("/api/employees/{employeeId}", courierId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.full_name").value("Ivan Courier"))
                .andExpect(jsonPath("$.cash_balance").value(0.00));

        printSuccess("Courier settled");
    }

    @Test
    @DisplayName("Nothing to hand over returns 409, empty list returns 400")
    void testHandoverErrors() throws Exception {
        Long card = createOrder(PaymentMethod.CARD, "10.00", courierId, null);

        mockMvc.perform(post("/api/shifts/{shiftId}/handovers", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employee_id\": " + courierId + ", \"order_ids\": [" + card + "]}"))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/shifts/{shiftId}/handovers", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employee_id\": " + courierId + ", \"order_ids\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.orderIds").exists());

        mockMvc.perform(get("/api/employees/{employeeId}", 999_999L))
                .andExpect(status().isNotFound());
    }
}
