package org.dpg.jobprocessor.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Objects;

/**
 * Typed reference to the entity a job was started for, e.g. Unit 42 or Metadata 17.
 */
@Getter
@Embeddable
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Originator {

    @Column(name = "originator_type", nullable = false)
    private OriginatorType type;

    @Column(name = "originator_id", nullable = false)
    private Long id;

    public static Originator of(final OriginatorType type, final long id) {
        return new Originator(Objects.requireNonNull(type, "type"), id);
    }

    public static Originator unit(final long unitId) {
        return of(OriginatorType.UNIT, unitId);
    }

    public static Originator metadata(final long metadataId) {
        return of(OriginatorType.METADATA, metadataId);
    }

    public static Originator order(final long orderId) {
        return of(OriginatorType.ORDER, orderId);
    }

    public static Originator staffMember(final long staffMemberId) {
        return of(OriginatorType.STAFF_MEMBER, staffMemberId);
    }

    public static Originator masterFile(final long masterFileId) {
        return of(OriginatorType.MASTER_FILE, masterFileId);
    }

    @Override
    public String toString() {
        return type.getValue() + "/" + id;
    }
}
