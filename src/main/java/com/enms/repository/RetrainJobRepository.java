package com.enms.repository;

import com.enms.model.RetrainJob;
import com.enms.model.RetrainJobState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RetrainJobRepository extends JpaRepository<RetrainJob, UUID> {

    List<RetrainJob> findByMachineIdAndStateIn(String machineId, Collection<RetrainJobState> states);

    List<RetrainJob> findByMachineIdOrderByCreatedAtDesc(String machineId);

    List<RetrainJob> findByState(RetrainJobState state);
}
