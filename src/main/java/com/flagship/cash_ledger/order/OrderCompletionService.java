package com.flagship.cash_ledger.order;

import com.flagship.cash_ledger.employee.DebtLedgerService;
import com.flagship.cash_ledger.exception.OrderNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Ledger side of an order reaching a completed status.
 *
 * The order is linked to a shift first. A cash order then becomes a debt of
 * its courier, else of its waiter; with neither, the cash went straight into
 * the drawer. Runs as one transaction, so a failed debt registration also
 * undoes the link.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderCompletionService {

    private final OrderRepository orderRepository;
    private final OrderShiftLinker linker;
    private final DebtLedgerService debtLedgerService;

    /**
     * @param actingEmployeeId employee who completed the order, may be null
     * @throws OrderNotFoundException if the order does not exist
     */
    @Transactional
    public OrderCompletionResult onOrderCompleted(Long orderId, Long actingEmployeeId) {
        Optional<UUID> shiftId = linker.linkOrderToShift(orderId, actingEmployeeId);

        OrderEntity order = orderRepository.findByIdForUpdate(orderId)
            .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderCompletionResult result;
        if (!order.isCash()) {
            result = new OrderCompletionResult(orderId, shiftId.orElse(null), OrderSettlement.CARD, null);
        } else if (order.getCourierId() != null) {
            debtLedgerService.registerDebt(orderId, order.getCourierId());
            result = new OrderCompletionResult(orderId, shiftId.orElse(null),
                OrderSettlement.COURIER_DEBT, order.getCourierId());
        } else if (order.getWaiterId() != null) {
            debtLedgerService.registerDebt(orderId, order.getWaiterId());
            result = new OrderCompletionResult(orderId, shiftId.orElse(null),
                OrderSettlement.WAITER_DEBT, order.getWaiterId());
        } else {
            order.markCashTurnedIn();
            orderRepository.save(order);
            result = new OrderCompletionResult(orderId, shiftId.orElse(null), OrderSettlement.DRAWER, null);
        }

        log.info("Order {} completed: settlement={}, shiftId={}", orderId, result.getSettlement(), result.getShiftId());
        return result;
    }
}
