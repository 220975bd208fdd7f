package org.dpg.jobprocessor.model.converter;

import jakarta.persistence.Converter;
import org.dpg.jobprocessor.model.JobState;

@Converter(autoApply = true)
public class JobStateConverter extends PersistedValueConverter<JobState> {

    public JobStateConverter() {
        super(JobState.class);
    }
}
