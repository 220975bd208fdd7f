package org.dpg.jobprocessor.model.converter;

import jakarta.persistence.Converter;
import org.dpg.jobprocessor.model.MetadataType;

@Converter(autoApply = true)
public class MetadataTypeConverter extends PersistedValueConverter<MetadataType> {

    public MetadataTypeConverter() {
        super(MetadataType.class);
    }
}
