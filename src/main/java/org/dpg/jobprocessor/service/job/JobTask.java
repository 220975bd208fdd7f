package org.dpg.jobprocessor.service.job;

import org.dpg.jobprocessor.model.JobStatus;

/**
 * The body of a background job. Implementations report progress through {@link JobStatusService};
 * a thrown exception ends the job as failed.
 */
@FunctionalInterface
public interface JobTask {

    void execute(JobStatus job) throws Exception;

    /**
     * Called when {@link #execute} escaped with an exception or error, before the job is marked failed.
     * Finalization uses it to put the unit into error.
     */
    default void onUnexpectedFailure(JobStatus job, String reason) {
    }
}
