package org.dpg.jobprocessor.controller;

import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.dto.common.ApiResponse;
import org.dpg.jobprocessor.dto.job.JobEventView;
import org.dpg.jobprocessor.dto.job.JobStatusView;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of jobs and their event logs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Validated
public class JobStatusController implements JobStatusApi {

    private final JobStatusService jobStatusService;

    @Override
    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusView>> getJobStatus(
            @PathVariable @Positive(message = "Job ID must be a positive number.") final Long jobId) {
        log.debug("Fetching status of job {}", jobId);
        final JobStatusView view = JobStatusView.from(jobStatusService.read(jobId));

        final ApiResponse<JobStatusView> response = ApiResponse.<JobStatusView>builder()
                                                               .response(view)
                                                               .displayMessage("Job status retrieved successfully.")
                                                               .showMessage(true)
                                                               .statusCode(HttpStatus.OK.value())
                                                               .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/{jobId}/events")
    public ResponseEntity<ApiResponse<List<JobEventView>>> getJobEvents(
            @PathVariable @Positive(message = "Job ID must be a positive number.") final Long jobId) {
        log.debug("Fetching events of job {}", jobId);
        final List<JobEventView> events = jobStatusService.readEvents(jobId).stream().map(JobEventView::from)
                                                          .collect(Collectors.toList());

        final ApiResponse<List<JobEventView>> response = ApiResponse.<List<JobEventView>>builder()
                                                                    .response(events)
                                                                    .displayMessage("Job events retrieved successfully.")
                                                                    .showMessage(true)
                                                                    .statusCode(HttpStatus.OK.value())
                                                                    .build();
        return ResponseEntity.ok(response);
    }
}
