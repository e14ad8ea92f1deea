package com.enms.repository;

import com.enms.model.JobType;
import com.enms.model.SchedulerJobState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SchedulerJobStateRepository extends JpaRepository<SchedulerJobState, JobType> {
}
