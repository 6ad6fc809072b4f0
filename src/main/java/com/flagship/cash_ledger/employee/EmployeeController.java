package com.flagship.cash_ledger.employee;

import com.flagship.cash_ledger.employee.dto.EmployeeBalanceResponse;
import com.flagship.cash_ledger.employee.dto.OutstandingOrderResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read side of the debt ledger: who holds cash, and for which orders.
 */
@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final DebtLedgerService debtLedgerService;

    @GetMapping("/{employeeId}")
    public ResponseEntity<EmployeeBalanceResponse> getEmployee(@PathVariable("employeeId") Long employeeId) {
        return ResponseEntity.ok(EmployeeBalanceResponse.from(debtLedgerService.getEmployee(employeeId)));
    }

    @GetMapping("/debtors")
    public ResponseEntity<List<EmployeeBalanceResponse>> listDebtors() {
        return ResponseEntity.ok(debtLedgerService.listDebtors().stream()
            .map(EmployeeBalanceResponse::from)
            .toList());
    }

    @GetMapping("/{employeeId}/outstanding-orders")
    public ResponseEntity<List<OutstandingOrderResponse>> listOutstandingOrders(
            @PathVariable("employeeId") Long employeeId) {
        return ResponseEntity.ok(debtLedgerService.listOutstandingOrders(employeeId).stream()
            .map(OutstandingOrderResponse::from)
            .toList());
    }
}
