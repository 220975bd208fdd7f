package org.dpg.jobprocessor.service.project;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Project;
import org.dpg.jobprocessor.repository.ProjectRepository;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Records the outcome directly in the local {@code projects} table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.processing.projects", name = "mode", havingValue = "database")
public class DatabaseProjectNotifier implements ProjectNotifier {

    private final ProjectRepository projectRepository;
    private final JobStatusService jobStatusService;

    @Override
    public void finalizationSucceeded(final JobStatus job, final long unitId, final long processingMins) {
        projectRepository.findFirstByUnitId(unitId).ifPresent(project -> {
            project.setFinishedAt(LocalDateTime.now());
            project.setFailureReason(null);
            project.setTotalDurationMins(Math.toIntExact(processingMins));
            save(job, project);
        });
    }

    @Override
    public void finalizationFailed(final JobStatus job, final long unitId, final String reason, final long processingMins) {
        projectRepository.findFirstByUnitId(unitId).ifPresent(project -> {
            project.setFailureReason(reason);
            project.setTotalDurationMins(Math.toIntExact(processingMins));
            save(job, project);
        });
    }

    private void save(final JobStatus job, final Project project) {
        try {
            projectRepository.save(project);
        } catch (final DataAccessException e) {
            log.error("Updating project {} failed", project.getId(), e);
            jobStatusService.logError(job, "Unable to update project " + project.getId() + ": " + e.getMessage());
        }
    }
}
