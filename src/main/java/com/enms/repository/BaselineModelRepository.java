package com.enms.repository;

import com.enms.model.BaselineModel;
import com.enms.model.ModelStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BaselineModelRepository extends JpaRepository<BaselineModel, UUID> {

    List<BaselineModel> findByMachineIdOrderByVersionDesc(String machineId);

    List<BaselineModel> findByMachineIdAndStatus(String machineId, ModelStatus status);

    long countByMachineIdAndStatus(String machineId, ModelStatus status);

    @Query("SELECT COALESCE(MAX(m.version), 0) FROM BaselineModel m WHERE m.machineId = :machineId")
    int findMaxVersion(@Param("machineId") String machineId);
}
