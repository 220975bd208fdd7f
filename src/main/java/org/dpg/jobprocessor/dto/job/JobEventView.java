package org.dpg.jobprocessor.dto.job;

import org.dpg.jobprocessor.model.JobEvent;

import java.time.LocalDateTime;

public record JobEventView(Long id, String level, String text, LocalDateTime createdAt) {

    public static JobEventView from(JobEvent event) {
        return new JobEventView(event.getId(), event.getLevel().getLabel(), event.getText(), event.getCreatedAt());
    }
}
