package org.dpg.jobprocessor.model;

/**
 * An enumeration constant stored in the database (and written to JSON) as a fixed string value
 * rather than its Java name.
 */
public interface PersistedValue {

    String getValue();
}
