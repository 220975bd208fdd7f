package org.dpg.jobprocessor.service.project;

import org.dpg.jobprocessor.model.JobStatus;

/**
 * Tells the digitization project tracker how the finalization of a unit ended. A unit without a
 * project is not an error; the call does nothing.
 * <p>
 * Implementations never throw: the outcome of finalization is already decided, so a notification
 * problem is only logged against the job.
 */
public interface ProjectNotifier {

    void finalizationSucceeded(JobStatus job, long unitId, long processingMins);

    void finalizationFailed(JobStatus job, long unitId, String reason, long processingMins);
}
