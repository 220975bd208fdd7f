package org.dpg.jobprocessor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.dpg.jobprocessor.dto.common.ApiResponse;
import org.dpg.jobprocessor.dto.job.JobEventView;
import org.dpg.jobprocessor.dto.job.JobStatusView;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;

import java.util.List;

@Tag(name = "Job Status", description = "Polling endpoints for background jobs started by the workflow endpoints.")
public interface JobStatusApi {

    @Operation(summary = "Get Job Status",
            description = "Returns the current state of a job: running, finished or failure, with its failure count and terminal error.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Job status retrieved successfully.",
                                        "response": {
                                            "id": 1234,
                                            "name": "FinalizeUnit",
                                            "originatorType": "Unit",
                                            "originatorId": 42,
                                            "status": "finished",
                                            "failures": 0,
                                            "startedAt": "2024-05-01T10:15:30",
                                            "endedAt": "2024-05-01T10:42:02"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this ID.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusView>> getJobStatus(
            @Parameter(description = "The ID returned when the job was started.", required = true, example = "1234")
            @PathVariable Long jobId);

    @Operation(summary = "List Job Events",
            description = "Returns the event log of a job in the order the events were written.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Events retrieved.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Job events retrieved successfully.",
                                        "response": [
                                            {"id": 1, "level": "info", "text": "QA unit data", "createdAt": "2024-05-01T10:15:31"},
                                            {"id": 2, "level": "error", "text": "Unexpected file found: /digiserv-production/finalization/000000042/notes.doc", "createdAt": "2024-05-01T10:15:33"}
                                        ],
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No job with this ID.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<JobEventView>>> getJobEvents(
            @Parameter(description = "The ID returned when the job was started.", required = true, example = "1234")
            @PathVariable Long jobId);
}
