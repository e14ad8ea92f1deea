package com.enms.repository;

import com.enms.model.AbTest;
import com.enms.model.AbTestStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AbTestRepository extends JpaRepository<AbTest, UUID> {

    Optional<AbTest> findFirstByMachineIdAndStatus(String machineId, AbTestStatus status);

    List<AbTest> findByStatus(AbTestStatus status);

    /**
     * Running test for a machine, row-locked so concurrent scorers accumulate
     * trial samples without losing updates.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM AbTest t WHERE t.machineId = :machineId AND t.status = com.enms.model.AbTestStatus.RUNNING")
    Optional<AbTest> findRunningForUpdate(@Param("machineId") String machineId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM AbTest t WHERE t.id = :id")
    Optional<AbTest> findByIdForUpdate(@Param("id") UUID id);
}
