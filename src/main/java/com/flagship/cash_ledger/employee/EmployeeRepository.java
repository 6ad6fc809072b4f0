package com.flagship.cash_ledger.employee;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<EmployeeEntity, Long> {

    /**
     * Locks the employee row. Taken before opening a shift and before any
     * balance change, so per-employee mutations are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from EmployeeEntity e where e.id = :id")
    Optional<EmployeeEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("select e from EmployeeEntity e where e.cashBalance > 0 order by e.cashBalance desc, e.id asc")
    List<EmployeeEntity> findDebtors();
}
