package com.flagship.cash_ledger.handover;

import com.flagship.cash_ledger.handover.dto.HandoverRequest;
import com.flagship.cash_ledger.handover.dto.HandoverResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST endpoint for cash handovers into a cashier's shift.
 *
 * POST /api/shifts/{shiftId}/handovers settles the listed orders of one
 * employee and answers 201 with the amount moved and the balance left.
 * Debtor and outstanding-order lookups live in {@code EmployeeController}.
 */
@RestController
@RequestMapping("/api/shifts/{shiftId}/handovers")
@RequiredArgsConstructor
@Slf4j
public class HandoverController {

    private final HandoverService handoverService;

    /**
     * Processes a handover.
     *
     * @return 201 with the handover result; 409 if the shift is closed or no
     *         listed order awaits handover; 404 for an unknown shift or employee
     */
    @PostMapping
    public ResponseEntity<HandoverResponse> processHandover(@PathVariable("shiftId") UUID shiftId,
                                                            @Valid @RequestBody HandoverRequest request) {
        log.info("Received handover request: shiftId={}, employeeId={}, orderIds={}",
                shiftId, request.getEmployeeId(), request.getOrderIds());
        HandoverResult result = handoverService.processHandover(shiftId, request.getEmployeeId(), request.getOrderIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(HandoverResponse.from(result));
    }
}
