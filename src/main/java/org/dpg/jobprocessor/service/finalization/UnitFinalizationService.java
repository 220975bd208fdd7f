package org.dpg.jobprocessor.service.finalization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.exception.FinalizationRejectedException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Originator;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.job.JobTask;
import org.springframework.stereotype.Service;

/**
 * Accepts a finalization request: checks the unit, claims it and starts the background run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnitFinalizationService {

    public static final String JOB_NAME = "FinalizeUnit";

    private final UnitRepository unitRepository;
    private final JobStatusService jobStatusService;
    private final BackgroundJobRunner backgroundJobRunner;
    private final UnitFinalizationWorkflow workflow;
    private final FinalizationFailureHandler failureHandler;

    /**
     * Moves the unit to {@code finalizing} in one conditional update and launches the run.
     *
     * @return id of the finalization job.
     * @throws ResourceNotFoundException     if the unit does not exist.
     * @throws FinalizationRejectedException if the unit is a reorder, already finalizing or not approved.
     */
    public Long startFinalization(final long unitId) {
        final Unit unit = unitRepository.findById(unitId)
                                        .orElseThrow(() -> new ResourceNotFoundException("Unit " + unitId + " not found"));
        final UnitStatus priorStatus = unit.getStatus();

        final int claimed = unitRepository.claimForFinalization(unitId, UnitStatus.FINALIZATION_START_STATUSES,
                                                                UnitStatus.FINALIZING);
        if (claimed == 0) {
            throw new FinalizationRejectedException(rejectionReason(unit));
        }

        final JobStatus job;
        try {
            job = jobStatusService.create(JOB_NAME, Originator.unit(unitId));
        } catch (final RuntimeException e) {
            log.error("Unable to create finalization job for unit {}; reverting status to {}", unitId, priorStatus, e);
            unitRepository.updateStatus(unitId, priorStatus);
            throw e;
        }

        if (priorStatus == UnitStatus.ERROR) {
            log.info("Unit {} restarts finalization", unitId);
        } else {
            log.info("Unit {} begins finalization", unitId);
        }
        backgroundJobRunner.launch(job, new JobTask() {
            @Override
            public void execute(final JobStatus running) {
                workflow.run(running, unitId, priorStatus);
            }

            @Override
            public void onUnexpectedFailure(final JobStatus failed, final String reason) {
                failureHandler.failUnit(failed, unitId, reason);
            }
        });
        return job.getId();
    }

    private static String rejectionReason(final Unit unit) {
        if (unit.isReorder()) {
            return "Unit is a re-order and should not be finalized.";
        }
        if (unit.getStatus() == UnitStatus.FINALIZING) {
            return "Unit is already finalizing.";
        }
        return "Unit has not been approved.";
    }
}
