package org.dpg.jobprocessor.model.converter;

import jakarta.persistence.Converter;
import org.dpg.jobprocessor.model.UnitStatus;

@Converter(autoApply = true)
public class UnitStatusConverter extends PersistedValueConverter<UnitStatus> {

    public UnitStatusConverter() {
        super(UnitStatus.class);
    }
}
