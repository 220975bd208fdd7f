package org.dpg.jobprocessor.dto.archivesspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchivesSpaceSession(String session) {
}
