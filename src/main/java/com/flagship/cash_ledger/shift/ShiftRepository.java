package com.flagship.cash_ledger.shift;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for cash shifts.
 *
 * The *ForUpdate variants take a row lock (SELECT ... FOR UPDATE). Every
 * mutation that targets a shift goes through one of them, so appends,
 * order linkage, handovers and the close of one shift are serialized.
 */
@Repository
public interface ShiftRepository extends JpaRepository<ShiftEntity, UUID> {

    Optional<ShiftEntity> findFirstByEmployeeIdAndClosedFalse(Long employeeId);

    Optional<ShiftEntity> findFirstByClosedFalseOrderByStartTimeDesc();

    List<ShiftEntity> findByEmployeeIdOrderByStartTimeDesc(Long employeeId);

    List<ShiftEntity> findAllByOrderByStartTimeDesc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ShiftEntity s where s.id = :id")
    Optional<ShiftEntity> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ShiftEntity s where s.employeeId = :employeeId and s.closed = false")
    Optional<ShiftEntity> findOpenByEmployeeIdForUpdate(@Param("employeeId") Long employeeId);

    /**
     * Locks the most recently opened shift; callers pass {@code PageRequest.of(0, 1)}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ShiftEntity s where s.closed = false order by s.startTime desc")
    List<ShiftEntity> findLatestOpenForUpdate(Pageable pageable);
}
