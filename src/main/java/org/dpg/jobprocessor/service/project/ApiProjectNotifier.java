package org.dpg.jobprocessor.service.project;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.projects.ProjectsApiClient;
import org.dpg.jobprocessor.dto.project.ProjectFailedRequest;
import org.dpg.jobprocessor.dto.project.ProjectLookupResponse;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reports to the remote project tracker over HTTP.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.processing.projects", name = "mode", havingValue = "api", matchIfMissing = true)
public class ApiProjectNotifier implements ProjectNotifier {

    private final ProjectsApiClient projectsApiClient;
    private final JobStatusService jobStatusService;

    @Override
    public void finalizationSucceeded(final JobStatus job, final long unitId, final long processingMins) {
        final Optional<Long> projectId = lookup(job, unitId);
        if (projectId.isEmpty()) {
            return;
        }
        jobStatusService.logInfo(job, "Marking project " + projectId.get() + " finished");
        try {
            projectsApiClient.finishProject(projectId.get(), processingMins);
        } catch (final ApiException e) {
            log.error("Finishing project {} failed", projectId.get(), e);
            jobStatusService.logError(job, "Unable to finish project: " + e.getStatusCode() + ":" + e.getMessage());
        }
    }

    @Override
    public void finalizationFailed(final JobStatus job, final long unitId, final String reason, final long processingMins) {
        final Optional<Long> projectId = lookup(job, unitId);
        if (projectId.isEmpty()) {
            return;
        }
        try {
            projectsApiClient.failProject(projectId.get(), new ProjectFailedRequest(reason, processingMins, job.getId()));
        } catch (final ApiException e) {
            log.error("CRITICAL: Unable to mark project {} failed", projectId.get(), e);
            jobStatusService.logError(job, "Unable to fail project: " + e.getStatusCode() + ":" + e.getMessage());
        }
    }

    private Optional<Long> lookup(final JobStatus job, final long unitId) {
        try {
            final ProjectLookupResponse project = projectsApiClient.lookupByUnit(unitId);
            if (project == null || !project.exists() || project.projectId() == null) {
                log.debug("Unit {} has no project", unitId);
                return Optional.empty();
            }
            return Optional.of(project.projectId());
        } catch (final ApiException e) {
            log.error("Project lookup for unit {} failed", unitId, e);
            jobStatusService.logError(job, "Unable to look up project for unit " + unitId + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}
