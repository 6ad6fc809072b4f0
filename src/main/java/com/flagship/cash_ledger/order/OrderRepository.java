package com.flagship.cash_ledger.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from OrderEntity o where o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") Long id);

    /**
     * Locks the cash orders among {@code ids} whose money has not reached a drawer yet.
     * Ids that are unknown, paid by card or already turned in are simply not returned.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select o from OrderEntity o
        where o.id in :ids
          and o.paymentMethod = com.flagship.cash_ledger.order.PaymentMethod.CASH
          and o.cashTurnedIn = false
        order by o.id
        """)
    List<OrderEntity> findAwaitingHandoverForUpdate(@Param("ids") Collection<Long> ids);

    /**
     * Cash orders an employee delivered or served whose cash is still with them.
     */
    @Query("""
        select o from OrderEntity o
        where (o.courierId = :employeeId or o.waiterId = :employeeId)
          and o.paymentMethod = com.flagship.cash_ledger.order.PaymentMethod.CASH
          and o.cashTurnedIn = false
        order by o.createdAt, o.id
        """)
    List<OrderEntity> findOutstandingCashOrders(@Param("employeeId") Long employeeId);
}
