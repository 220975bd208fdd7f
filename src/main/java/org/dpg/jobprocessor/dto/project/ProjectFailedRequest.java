package org.dpg.jobprocessor.dto.project;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProjectFailedRequest(String reason, long processingMins, @JsonProperty("jobID") long jobId) {
}
