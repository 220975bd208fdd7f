package org.dpg.jobprocessor.service.project;

import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Project;
import org.dpg.jobprocessor.repository.ProjectRepository;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseProjectNotifierTest {

    @Mock
    private ProjectRepository projectRepository;
    @Mock
    private JobStatusService jobStatusService;

    @InjectMocks
    private DatabaseProjectNotifier notifier;

    private final JobStatus job = new JobStatus();

    @Test
    void successStampsFinishedAndClearsFailure() {
        // given
        final Project project = project("Unit was not archived");
        when(projectRepository.findFirstByUnitId(42L)).thenReturn(Optional.of(project));

        // when
        notifier.finalizationSucceeded(job, 42L, 12L);

        // then
        assertThat(project.getFinishedAt()).isNotNull();
        assertThat(project.getFailureReason()).isNull();
        assertThat(project.getTotalDurationMins()).isEqualTo(12);
        verify(projectRepository).save(project);
    }

    @Test
    void failureRecordsReasonWithoutFinishing() {
        // given
        final Project project = project(null);
        when(projectRepository.findFirstByUnitId(42L)).thenReturn(Optional.of(project));

        // when
        notifier.finalizationFailed(job, 42L, "Unit was not archived", 3L);

        // then
        assertThat(project.getFinishedAt()).isNull();
        assertThat(project.getFailureReason()).isEqualTo("Unit was not archived");
        assertThat(project.getTotalDurationMins()).isEqualTo(3);
    }

    @Test
    void unitWithoutProjectIsIgnored() {
        // given
        when(projectRepository.findFirstByUnitId(42L)).thenReturn(Optional.empty());

        // when
        notifier.finalizationSucceeded(job, 42L, 12L);

        // then
        verify(projectRepository, never()).save(any());
    }

    @Test
    void saveFailureIsLoggedAgainstJob() {
        // given
        final Project project = project(null);
        when(projectRepository.findFirstByUnitId(42L)).thenReturn(Optional.of(project));
        when(projectRepository.save(project)).thenThrow(new DataIntegrityViolationException("constraint"));

        // when
        notifier.finalizationSucceeded(job, 42L, 12L);

        // then
        verify(jobStatusService).logError(job, "Unable to update project 7: constraint");
    }

    private static Project project(final String failureReason) {
        final Project project = new Project();
        project.setId(7L);
        project.setUnitId(42L);
        project.setFailureReason(failureReason);
        return project;
    }
}
