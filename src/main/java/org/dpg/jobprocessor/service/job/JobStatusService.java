package org.dpg.jobprocessor.service.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.model.*;
import org.dpg.jobprocessor.repository.JobEventRepository;
import org.dpg.jobprocessor.repository.JobStatusRepository;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Records the lifecycle of a job: its status row and its append-only event log.
 * <p>
 * Every write runs in its own {@code REQUIRES_NEW} transaction so that a job's progress is durable the
 * moment it is logged, whatever the caller's transaction does afterwards. The two terminal transitions
 * are conditional updates, so only the first of {@link #logFatal} or {@link #done} takes effect.
 * <p>
 * The logging methods accept a {@code null} job; the text then only goes to the application log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusService {

    private final JobStatusRepository jobStatusRepository;
    private final JobEventRepository jobEventRepository;

    /**
     * Creates a running job for the originator. Nothing is started here; callers hand the returned
     * job to {@link BackgroundJobRunner}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public JobStatus create(final String name, final Originator originator) {
        final JobStatus job = new JobStatus();
        job.setName(name);
        job.setOriginator(originator);
        job.setStatus(JobState.RUNNING);
        job.setFailures(0);
        job.setStartedAt(LocalDateTime.now());
        final JobStatus saved = jobStatusRepository.save(job);
        log.info("Job ID {}: created {} for {}", saved.getId(), name, originator);
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logInfo(@Nullable final JobStatus job, final String text) {
        if (job == null) {
            log.info(text);
            return;
        }
        log.info("Job ID {}: {}", job.getId(), text);
        appendEvent(job, EventLevel.INFO, text);
    }

    /**
     * Records a non-fatal error and bumps the failure count. The job keeps running.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logError(@Nullable final JobStatus job, final String text) {
        if (job == null) {
            log.warn(text);
            return;
        }
        log.warn("Job ID {}: {}", job.getId(), text);
        if (jobStatusRepository.incrementFailures(job.getId()) == 0) {
            log.error("CRITICAL: Job ID {} not found, error not recorded: {}", job.getId(), text);
            return;
        }
        appendEvent(job, EventLevel.ERROR, text);
        job.setFailures(job.getFailures() + 1);
    }

    /**
     * Ends a running job as failed with {@code text} as its error. A job that has already ended is
     * left alone and no event is written.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logFatal(@Nullable final JobStatus job, final String text) {
        if (job == null) {
            log.error(text);
            return;
        }
        final LocalDateTime now = LocalDateTime.now();
        final int updated = jobStatusRepository.endIfRunning(job.getId(), JobState.FAILURE, text, now);
        if (updated == 0) {
            log.warn("Job ID {}: already ended, ignoring fatal error: {}", job.getId(), text);
            return;
        }
        log.error("Job ID {}: {}", job.getId(), text);
        appendEvent(job, EventLevel.FATAL, text);
        job.setStatus(JobState.FAILURE);
        job.setError(text);
        job.setEndedAt(now);
    }

    /**
     * Ends a running job as finished. Has no effect on a job that has already ended, including one
     * that failed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void done(final JobStatus job) {
        final LocalDateTime now = LocalDateTime.now();
        final int updated = jobStatusRepository.finishIfRunning(job.getId(), JobState.FINISHED, now);
        if (updated == 0) {
            log.debug("Job ID {}: already ended, not marking finished", job.getId());
            return;
        }
        log.info("Job ID {}: {} finished", job.getId(), job.getName());
        appendEvent(job, EventLevel.INFO, "job finished");
        job.setStatus(JobState.FINISHED);
        job.setEndedAt(now);
    }

    @Transactional(readOnly = true)
    public JobStatus read(final Long jobId) {
        return jobStatusRepository.findById(jobId).orElseThrow(
                () -> new ResourceNotFoundException("Job " + jobId + " not found"));
    }

    @Transactional(readOnly = true)
    public List<JobEvent> readEvents(final Long jobId) {
        if (!jobStatusRepository.existsById(jobId)) {
            throw new ResourceNotFoundException("Job " + jobId + " not found");
        }
        return jobEventRepository.findByJobStatusIdOrderByIdAsc(jobId);
    }

    /**
     * Ends every job still marked running. Only safe at startup, before this instance accepts work.
     *
     * @return the number of jobs that were ended.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int failRunningJobs(final String reason) {
        int failed = 0;
        for (final JobStatus job : jobStatusRepository.findByStatus(JobState.RUNNING)) {
            if (jobStatusRepository.endIfRunning(job.getId(), JobState.FAILURE, reason, LocalDateTime.now()) == 1) {
                appendEvent(job, EventLevel.FATAL, reason);
                log.warn("Job ID {}: {} ({})", job.getId(), reason, job.getName());
                failed++;
            }
        }
        return failed;
    }

    private void appendEvent(final JobStatus job, final EventLevel level, final String text) {
        jobEventRepository.save(JobEvent.builder().jobStatusId(job.getId()).level(level).text(text).build());
    }
}
