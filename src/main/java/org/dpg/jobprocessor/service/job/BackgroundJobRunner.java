package org.dpg.jobprocessor.service.job;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.model.JobStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Runs a {@link JobTask} on the application task executor and guarantees the job ends in a terminal
 * state. Anything the task throws, including an {@link Error}, is logged with its stack trace and
 * recorded as a fatal event; the worker thread itself keeps serving other jobs.
 * <p>
 * When called inside a transaction, the task is submitted only after that transaction commits.
 */
@Slf4j
@Service
public class BackgroundJobRunner {

    private final AsyncTaskExecutor taskExecutor;
    private final JobStatusService jobStatusService;

    public BackgroundJobRunner(@Qualifier("applicationTaskExecutor") final AsyncTaskExecutor taskExecutor,
                               final JobStatusService jobStatusService) {
        this.taskExecutor = taskExecutor;
        this.jobStatusService = jobStatusService;
    }

    public void launch(final JobStatus job, final JobTask task) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(job, task);
                }
            });
        } else {
            submit(job, task);
        }
    }

    private void submit(final JobStatus job, final JobTask task) {
        try {
            taskExecutor.execute(() -> runGuarded(job, task));
            log.debug("Job ID {}: submitted {}", job.getId(), job.getName());
        } catch (final TaskRejectedException e) {
            log.error("Job ID {}: executor rejected {}", job.getId(), job.getName(), e);
            jobStatusService.logFatal(job, "Unable to start " + job.getName() + ": the job queue is full");
        }
    }

    /**
     * Runs the task on the calling thread. Package-private for tests.
     */
    void runGuarded(final JobStatus job, final JobTask task) {
        try {
            task.execute(job);
        } catch (final Throwable t) {
            final String reason = "Unexpected error during " + job.getName() + ": " + describe(t);
            log.error("Job ID {}: {}", job.getId(), reason, t);
            try {
                task.onUnexpectedFailure(job, reason);
            } catch (final Exception cleanupError) {
                log.error("CRITICAL: Job ID {}: failure handler for {} threw", job.getId(), job.getName(), cleanupError);
            }
            try {
                jobStatusService.logFatal(job, reason);
            } catch (final Exception statusError) {
                log.error("CRITICAL: Job ID {}: could not record failure. The job may be left running.",
                          job.getId(), statusError);
            }
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return;
        }
        try {
            jobStatusService.done(job);
        } catch (final Exception e) {
            log.error("CRITICAL: Job ID {}: could not mark {} finished", job.getId(), job.getName(), e);
        }
    }

    private static String describe(final Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
