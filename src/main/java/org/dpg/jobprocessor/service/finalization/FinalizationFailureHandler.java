package org.dpg.jobprocessor.service.finalization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.project.ProjectNotifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Single place a finalization run ends in failure: the unit goes to {@code error}, the job fails and
 * the project tracker is told. Reached both from a failed phase and from an unexpected exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinalizationFailureHandler {

    private final UnitRepository unitRepository;
    private final JobStatusService jobStatusService;
    private final ProjectNotifier projectNotifier;

    public void failUnit(final JobStatus job, final long unitId, final String reason) {
        try {
            unitRepository.updateStatus(unitId, UnitStatus.ERROR);
        } catch (final RuntimeException e) {
            log.error("CRITICAL: Job ID {}: unable to set unit {} to error. It stays finalizing.", job.getId(), unitId, e);
        }
        jobStatusService.logFatal(job, reason);
        projectNotifier.finalizationFailed(job, unitId, reason, processingMinutes(job));
    }

    /**
     * Minutes since the job started, rounded to the nearest minute.
     */
    static long processingMinutes(final JobStatus job) {
        final long seconds = Duration.between(job.getStartedAt(), LocalDateTime.now()).toSeconds();
        return Math.round(seconds / 60.0);
    }
}
