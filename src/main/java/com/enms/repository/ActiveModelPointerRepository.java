package com.enms.repository;

import com.enms.model.ActiveModelPointer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Indexed lookup of the active model per machine.
 */
@Repository
public interface ActiveModelPointerRepository extends JpaRepository<ActiveModelPointer, String> {

    /**
     * Replace the active model only if it is still the expected one.
     *
     * @return 1 when swapped, 0 when another writer got there first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ActiveModelPointer p SET p.modelId = :newModelId, p.updatedAt = :now " +
           "WHERE p.machineId = :machineId AND p.modelId = :expectedModelId")
    int compareAndSwap(
        @Param("machineId") String machineId,
        @Param("expectedModelId") UUID expectedModelId,
        @Param("newModelId") UUID newModelId,
        @Param("now") Instant now
    );
}
