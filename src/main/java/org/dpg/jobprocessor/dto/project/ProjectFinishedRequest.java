package org.dpg.jobprocessor.dto.project;

public record ProjectFinishedRequest(long processingMins) {
}
