package com.flagship.cash_ledger.order;

import com.flagship.cash_ledger.exception.OrderNotFoundException;
import com.flagship.cash_ledger.observability.LedgerMetrics;
import com.flagship.cash_ledger.shift.ShiftEntity;
import com.flagship.cash_ledger.shift.ShiftService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Attributes completed orders to exactly one shift for reporting.
 *
 * The link is set once. Target resolution prefers the acting employee's open
 * shift and falls back to the most recently opened shift of anyone. The target
 * shift row is locked before the order is touched, so a link can not land in a
 * shift that is concurrently being closed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderShiftLinker {

    private final OrderRepository orderRepository;
    private final ShiftService shiftService;
    private final LedgerMetrics metrics;

    /**
     * Links the order to a shift unless it already is.
     *
     * @return the shift the order is linked to, or empty when no shift is open
     *         anywhere; the order then stays unlinked for good
     * @throws OrderNotFoundException if the order does not exist
     */
    @Transactional
    public Optional<UUID> linkOrderToShift(Long orderId, Long preferredEmployeeId) {
        // Shift before order: the lock order shared with handover and close.
        Optional<ShiftEntity> target = shiftService.lockAttributionTarget(preferredEmployeeId)
            .filter(shift -> !shift.isClosed());

        OrderEntity order = orderRepository.findByIdForUpdate(orderId)
            .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (order.isLinked()) {
            metrics.recordOrderLinked("already_linked");
            return Optional.of(order.getCashShiftId());
        }

        if (target.isEmpty()) {
            log.warn("Order {} completed while no cash shift is open, it stays unlinked", orderId);
            metrics.recordOrderUnlinked();
            return Optional.empty();
        }

        ShiftEntity shift = target.get();
        order.linkToShift(shift.getId());
        orderRepository.save(order);

        boolean preferred = preferredEmployeeId != null && preferredEmployeeId.equals(shift.getEmployeeId());
        metrics.recordOrderLinked(preferred ? "preferred" : "fallback");
        log.info("Linked order {} to shift {}", orderId, shift.getId());
        return Optional.of(shift.getId());
    }
}
