package org.dpg.jobprocessor.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Severity of a {@link JobEvent}. Declaration order is severity order and is persisted as the
 * ordinal (info = 0 ... fatal = 3).
 */
@Getter
@RequiredArgsConstructor
public enum EventLevel {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    FATAL("fatal");

    @JsonValue
    private final String label;
}
