package com.flagship.cash_ledger.shift;

import com.flagship.cash_ledger.observability.LedgerMetrics;
import com.flagship.cash_ledger.shift.dto.CloseShiftRequest;
import com.flagship.cash_ledger.shift.dto.OpenShiftRequest;
import com.flagship.cash_ledger.shift.dto.ShiftResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/shifts")
@RequiredArgsConstructor
@Slf4j
public class ShiftController {

    private final ShiftService shiftService;
    private final LedgerMetrics metrics;

    @PostMapping
    public ResponseEntity<ShiftResponse> openShift(@Valid @RequestBody OpenShiftRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Received open shift request: employeeId={}, startCash={}",
                request.getEmployeeId(), request.getStartCash());

        Shift shift = shiftService.openShift(request.getEmployeeId(), request.getStartCash());

        metrics.recordLatency("open_shift", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(HttpStatus.CREATED).body(ShiftResponse.from(shift));
    }

    @PostMapping("/{shiftId}/close")
    public ResponseEntity<ShiftResponse> closeShift(@PathVariable("shiftId") UUID shiftId,
                                                    @Valid @RequestBody CloseShiftRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Received close shift request: shiftId={}, endCashActual={}", shiftId, request.getEndCashActual());

        Shift shift = shiftService.closeShift(shiftId, request.getEndCashActual());

        metrics.recordLatency("close_shift", System.currentTimeMillis() - startTime);
        return ResponseEntity.ok(ShiftResponse.from(shift));
    }

    @GetMapping("/{shiftId}")
    public ResponseEntity<ShiftResponse> getShift(@PathVariable("shiftId") UUID shiftId) {
        return ResponseEntity.ok(ShiftResponse.from(shiftService.getShift(shiftId)));
    }

    /**
     * Open shift of an employee, or the most recently opened one when no employee is given.
     * 404 with an empty body when there is none.
     */
    @GetMapping("/open")
    public ResponseEntity<ShiftResponse> getOpenShift(
            @RequestParam(value = "employee_id", required = false) Long employeeId) {
        var shift = employeeId != null ? shiftService.getOpenShift(employeeId) : shiftService.getAnyOpenShift();
        return shift.map(s -> ResponseEntity.ok(ShiftResponse.from(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<ShiftResponse>> listShifts(
            @RequestParam(value = "employee_id", required = false) Long employeeId) {
        return ResponseEntity.ok(shiftService.listShifts(employeeId).stream()
                .map(ShiftResponse::from)
                .toList());
    }
}
