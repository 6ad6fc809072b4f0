package com.flagship.cash_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cash_ledger.AbstractIntegrationTest;
import com.flagship.cash_ledger.shift.Shift;
import com.flagship.cash_ledger.shift.ShiftService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of manual cash movements.
 *
 * Redis is not reachable in the test profile, so Idempotency-Key replays are
 * resolved through the database fallback.
 */
@AutoConfigureMockMvc
class TransactionControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ShiftService shiftService;

    private Shift shift;

    @BeforeEach
    void setUp() {
        Long cashierId = createEmployee("Olena Cashier");
        shift = shiftService.openShift(cashierId, new BigDecimal("100.00"));
    }

    @Test
    @DisplayName("POST records a manual withdrawal and returns 201")
    void testRecordTransaction_Created() throws Exception {
        printTestHeader("POST Manual Transaction");

        String body = "{\"amount\": 30.00, \"kind\": \"MANUAL_OUT\", \"comment\": \"bread\"}";

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shift_id").value(shift.getId().toString()))
                .andExpect(jsonPath("$.kind").value("MANUAL_OUT"))
                .andExpect(jsonPath("$.amount").value(30.00))
                .andExpect(jsonPath("$.comment").value("bread"));

        assertEquals(1, countTransactions(shift.getId()));
        printSuccess("Transaction created");
    }

    @Test
    @DisplayName("Retry with the same Idempotency-Key returns the original entry")
    void testRecordTransaction_IdempotentReplay() throws Exception {
        printTestHeader("Idempotent Replay");

        String body = "{\"amount\": 15.00, \"kind\": \"MANUAL_IN\"}";

        MvcResult first = mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .header("Idempotency-Key", "retry-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();

        MvcResult second = mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .header("Idempotency-Key", "retry-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode firstJson = objectMapper.readTree(first.getResponse().getContentAsString());
        JsonNode secondJson = objectMapper.readTree(second.getResponse().getContentAsString());
        printOutput("First ID", firstJson.get("id").asText());
        printOutput("Second ID", secondJson.get("id").asText());

        assertEquals(firstJson.get("id").asText(), secondJson.get("id").asText());
        assertEquals(1, countTransactions(shift.getId()));

        printSuccess("Cash moved once");
    }

    @Test
    @DisplayName("Reusing an Idempotency-Key on another shift is a conflict")
    void testRecordTransaction_KeyReusedOnOtherShift() throws Exception {
        Long otherCashier = createEmployee("Petro Cashier");
        Shift other = shiftService.openShift(otherCashier, BigDecimal.ZERO);
        String body = "{\"amount\": 5.00, \"kind\": \"MANUAL_IN\"}";

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .header("Idempotency-Key", "shared")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", other.getId())
                        .header("Idempotency-Key", "shared")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict());

        assertEquals(0, countTransactions(other.getId()));
    }

    @Test
    @DisplayName("Handover entries cannot be recorded directly")
    void testRecordTransaction_HandoverKindRejected() throws Exception {
        String body = "{\"amount\": 50.00, \"kind\": \"HANDOVER_IN\"}";

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Request"));

        assertEquals(0, countTransactions(shift.getId()));
    }

    @Test
    @DisplayName("Invalid amounts and missing fields return 400")
    void testRecordTransaction_BadRequests() throws Exception {
        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": -1.00, \"kind\": \"MANUAL_IN\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\": \"MANUAL_IN\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1.00, \"kind\": \"REFUND\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Recording on a closed shift returns 409")
    void testRecordTransaction_ClosedShift() throws Exception {
        shiftService.closeShift(shift.getId(), new BigDecimal("100.00"));

        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1.00, \"kind\": \"MANUAL_IN\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("GET lists the shift's entries in order")
    void testListTransactions() throws Exception {
        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 1.00, \"kind\": \"MANUAL_IN\", \"comment\": \"a\"}"));
        mockMvc.perform(post("/api/shifts/{shiftId}/transactions", shift.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 2.00, \"kind\": \"MANUAL_OUT\", \"comment\": \"b\"}"));

        mockMvc.perform(get("/api/shifts/{shiftId}/transactions", shift.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].comment").value("a"))
                .andExpect(jsonPath("$[1].comment").value("b"));
    }
}
