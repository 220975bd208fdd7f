package org.dpg.jobprocessor.model.converter;

import jakarta.persistence.Converter;
import org.dpg.jobprocessor.model.OriginatorType;

@Converter(autoApply = true)
public class OriginatorTypeConverter extends PersistedValueConverter<OriginatorType> {

    public OriginatorTypeConverter() {
        super(OriginatorType.class);
    }
}
