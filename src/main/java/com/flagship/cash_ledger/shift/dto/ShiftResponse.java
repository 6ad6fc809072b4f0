package com.flagship.cash_ledger.shift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.shift.Shift;
import com.flagship.cash_ledger.shift.ShiftTotals;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Shift as returned by the API. Totals and discrepancy are null while the shift is open.
 */
@Value
@Builder
public class ShiftResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("employee_id")
    Long employeeId;

    @JsonProperty("status")
    String status;

    @JsonProperty("start_time")
    Instant startTime;

    @JsonProperty("end_time")
    Instant endTime;

    @JsonProperty("start_cash")
    BigDecimal startCash;

    @JsonProperty("end_cash_actual")
    BigDecimal endCashActual;

    @JsonProperty("total_sales_cash")
    BigDecimal totalSalesCash;

    @JsonProperty("total_sales_card")
    BigDecimal totalSalesCard;

    @JsonProperty("service_in")
    BigDecimal serviceIn;

    @JsonProperty("service_out")
    BigDecimal serviceOut;

    @JsonProperty("theoretical_cash")
    BigDecimal theoreticalCash;

    @JsonProperty("discrepancy")
    BigDecimal discrepancy;

    public static ShiftResponse from(Shift shift) {
        ShiftTotals totals = shift.getTotals();
        ShiftResponseBuilder builder = ShiftResponse.builder()
            .id(shift.getId())
            .employeeId(shift.getEmployeeId())
            .status(shift.isClosed() ? "CLOSED" : "OPEN")
            .startTime(shift.getStartTime())
            .endTime(shift.getEndTime())
            .startCash(shift.getStartCash())
            .endCashActual(shift.getEndCashActual())
            .discrepancy(shift.getDiscrepancy());
        if (totals != null) {
            builder.totalSalesCash(totals.getSalesCash())
                .totalSalesCard(totals.getSalesCard())
                .serviceIn(totals.getServiceIn())
                .serviceOut(totals.getServiceOut())
                .theoreticalCash(totals.getTheoreticalCash());
        }
        return builder.build();
    }
}
