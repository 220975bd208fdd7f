package org.dpg.jobprocessor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Set;

/**
 * Workflow status of a {@link Unit}. Finalization may begin from {@link #APPROVED} or resume from
 * {@link #ERROR}, and ends in {@link #DONE} or {@link #ERROR}.
 */
@Getter
@RequiredArgsConstructor
public enum UnitStatus implements PersistedValue {
    UNAPPROVED("unapproved"),
    APPROVED("approved"),
    CONDITION("condition"),
    COPYRIGHT("copyright"),
    CANCELED("canceled"),
    FINALIZING("finalizing"),
    ERROR("error"),
    DONE("done");

    /**
     * Statuses from which a finalization run may start.
     */
    public static final Set<UnitStatus> FINALIZATION_START_STATUSES = Set.of(APPROVED, ERROR);

    private final String value;
}
