package com.flagship.cash_ledger.statistics;

import com.flagship.cash_ledger.statistics.dto.ShiftStatisticsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Read-only reporting endpoints: per-shift statistics and the cash flow
 * report. Nothing here takes locks or writes.
 */
@RestController
@RequiredArgsConstructor
public class ReportController {

    private final ShiftStatisticsService statisticsService;
    private final CashFlowReportService cashFlowReportService;

    /**
     * X-report of an open shift, or the recomputed Z-report of a closed one.
     */
    @GetMapping("/api/shifts/{shiftId}/statistics")
    public ResponseEntity<ShiftStatisticsResponse> getStatistics(@PathVariable("shiftId") UUID shiftId) {
        return ResponseEntity.ok(ShiftStatisticsResponse.from(statisticsService.computeStatistics(shiftId)));
    }

    /**
     * Cash flow between two dates, both inclusive, in UTC days. Defaults to today.
     */
    @GetMapping("/api/reports/cash-flow")
    public ResponseEntity<CashFlowReport> getCashFlow(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        LocalDate start = from != null ? from : today;
        LocalDate end = to != null ? to : today;
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("'to' must not be before 'from'");
        }
        return ResponseEntity.ok(cashFlowReportService.buildReport(
            start.atStartOfDay(ZoneOffset.UTC).toInstant(),
            end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()));
    }
}
