package org.dpg.jobprocessor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Source of a descriptive metadata record.
 */
@Getter
@RequiredArgsConstructor
public enum MetadataType implements PersistedValue {
    /**
     * Catalog record from the ILS, identified by a catalog key.
     */
    SIRSI("SirsiMetadata"),
    /**
     * Locally maintained descriptive XML.
     */
    XML("XmlMetadata"),
    /**
     * Record owned by an external system such as ArchivesSpace.
     */
    EXTERNAL("ExternalMetadata");

    private final String value;
}
