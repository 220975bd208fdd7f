package org.dpg.jobprocessor.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Fails the jobs a previous instance left running. Their background tasks died with that process,
 * so nothing would ever end them. Units caught mid-finalization go back to {@code error} so they
 * can be finalized again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.scheduler", name = "interrupted-job-recovery-enabled", havingValue = "true",
        matchIfMissing = true)
public class InterruptedJobRecovery {

    static final String INTERRUPTED_REASON = "Job interrupted by service restart";

    private final JobStatusService jobStatusService;
    private final UnitRepository unitRepository;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedJobs() {
        log.info("Looking for jobs interrupted by the last shutdown.");
        final int jobs = jobStatusService.failRunningJobs(INTERRUPTED_REASON);
        final int units = unitRepository.updateAllStatuses(UnitStatus.FINALIZING, UnitStatus.ERROR);
        if (jobs == 0 && units == 0) {
            log.info("No interrupted jobs found.");
            return;
        }
        log.warn("Failed {} interrupted jobs and returned {} finalizing units to error.", jobs, units);
    }
}
