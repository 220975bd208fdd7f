package org.dpg.jobprocessor.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle state of a {@link JobStatus}. A job leaves {@link #RUNNING} exactly once.
 */
@Getter
@RequiredArgsConstructor
public enum JobState implements PersistedValue {
    /**
     * Background work has been accepted and has not reached a terminal transition.
     */
    RUNNING("running"),

    /**
     * The job ended through the normal completion transition.
     */
    FINISHED("finished"),

    /**
     * The job ended through a fatal error.
     */
    FAILURE("failure");

    @JsonValue
    private final String value;
}
