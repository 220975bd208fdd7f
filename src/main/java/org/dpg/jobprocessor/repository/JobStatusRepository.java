package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.JobState;
import org.dpg.jobprocessor.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link JobStatus} entity.
 * <p>
 * The terminal transitions are conditional updates on {@code endedAt IS NULL}; the returned row
 * count tells the caller whether its transition won.
 */
@Repository
public interface JobStatusRepository extends JpaRepository<JobStatus, Long> {

    List<JobStatus> findByStatus(JobState status);

    @Transactional
    @Modifying
    @Query("UPDATE JobStatus j SET j.failures = j.failures + 1 WHERE j.id = :id")
    int incrementFailures(@Param("id") Long id);

    /**
     * Moves a still-running job to {@code failure}.
     *
     * @return 1 if the job was running, 0 if it had already ended or does not exist.
     */
    @Transactional
    @Modifying
    @Query("UPDATE JobStatus j SET j.status = :status, j.error = :error, j.endedAt = :endedAt " +
           "WHERE j.id = :id AND j.endedAt IS NULL")
    int endIfRunning(@Param("id") Long id,
                     @Param("status") JobState status,
                     @Param("error") String error,
                     @Param("endedAt") LocalDateTime endedAt);

    @Transactional
    @Modifying
    @Query("UPDATE JobStatus j SET j.status = :status, j.endedAt = :endedAt " +
           "WHERE j.id = :id AND j.endedAt IS NULL")
    int finishIfRunning(@Param("id") Long id,
                        @Param("status") JobState status,
                        @Param("endedAt") LocalDateTime endedAt);
}
