package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.EventLevel;
import org.dpg.jobprocessor.model.JobEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobEventRepository extends JpaRepository<JobEvent, Long> {

    List<JobEvent> findByJobStatusIdOrderByIdAsc(Long jobStatusId);

    long countByJobStatusIdAndLevel(Long jobStatusId, EventLevel level);
}
