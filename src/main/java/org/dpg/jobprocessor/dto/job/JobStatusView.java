package org.dpg.jobprocessor.dto.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.dpg.jobprocessor.model.JobStatus;

import java.time.LocalDateTime;

/**
 * Polling view of a job. {@code status} is one of {@code running}, {@code finished}, {@code failure}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusView(Long id, String name, String originatorType, Long originatorId, String status,
                            int failures, String error, LocalDateTime startedAt, LocalDateTime endedAt) {

    public static JobStatusView from(JobStatus job) {
        return new JobStatusView(job.getId(), job.getName(), job.getOriginator().getType().getValue(),
                                 job.getOriginator().getId(), job.getStatus().getValue(), job.getFailures(),
                                 job.getError(), job.getStartedAt(), job.getEndedAt());
    }
}
