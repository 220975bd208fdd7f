package org.dpg.jobprocessor.model.converter;

import jakarta.persistence.AttributeConverter;
import org.dpg.jobprocessor.model.PersistedValue;

import java.util.Arrays;

/**
 * Maps a {@link PersistedValue} enum to and from its stored string.
 *
 * @param <E> the enum type
 */
public abstract class PersistedValueConverter<E extends Enum<E> & PersistedValue> implements AttributeConverter<E, String> {

    private final Class<E> enumType;

    protected PersistedValueConverter(final Class<E> enumType) {
        this.enumType = enumType;
    }

    @Override
    public String convertToDatabaseColumn(final E attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public E convertToEntityAttribute(final String dbData) {
        if (dbData == null) {
            return null;
        }
        return Arrays.stream(enumType.getEnumConstants())
                     .filter(constant -> constant.getValue().equals(dbData))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(
                             "Unknown " + enumType.getSimpleName() + " value: " + dbData));
    }
}
