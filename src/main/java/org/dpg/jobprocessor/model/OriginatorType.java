package org.dpg.jobprocessor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The kinds of entity that can trigger a job.
 */
@Getter
@RequiredArgsConstructor
public enum OriginatorType implements PersistedValue {
    UNIT("Unit"),
    METADATA("Metadata"),
    ORDER("Order"),
    STAFF_MEMBER("StaffMember"),
    MASTER_FILE("MasterFile");

    private final String value;
}
