package com.flagship.cash_ledger.statistics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.cash_ledger.statistics.ShiftStatistics;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ShiftStatisticsResponse {

    @JsonProperty("shift_id")
    UUID shiftId;

    @JsonProperty("report_type")
    String reportType;

    @JsonProperty("start_time")
    Instant startTime;

    @JsonProperty("start_cash")
    BigDecimal startCash;

    @JsonProperty("sales_cash")
    BigDecimal salesCash;

    @JsonProperty("sales_card")
    BigDecimal salesCard;

    @JsonProperty("total_sales")
    BigDecimal totalSales;

    @JsonProperty("service_in")
    BigDecimal serviceIn;

    @JsonProperty("service_out")
    BigDecimal serviceOut;

    @JsonProperty("handover_in")
    BigDecimal handoverIn;

    @JsonProperty("collected_cash_orders")
    BigDecimal collectedCashOrders;

    @JsonProperty("theoretical_cash")
    BigDecimal theoreticalCash;

    public static ShiftStatisticsResponse from(ShiftStatistics statistics) {
        return ShiftStatisticsResponse.builder()
            .shiftId(statistics.getShiftId())
            .reportType(statistics.isClosed() ? "Z" : "X")
            .startTime(statistics.getStartTime())
            .startCash(statistics.getStartCash())
            .salesCash(statistics.getSalesCash())
            .salesCard(statistics.getSalesCard())
            .totalSales(statistics.getTotalSales())
            .serviceIn(statistics.getServiceIn())
            .serviceOut(statistics.getServiceOut())
            .handoverIn(statistics.getHandoverIn())
            .collectedCashOrders(statistics.getCollectedCashOrders())
            .theoreticalCash(statistics.getTheoreticalCash())
            .build();
    }
}
