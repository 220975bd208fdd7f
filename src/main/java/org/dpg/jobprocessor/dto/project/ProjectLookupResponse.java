package org.dpg.jobprocessor.dto.project;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectLookupResponse(boolean exists,
                                    @JsonProperty("projectID") Long projectId,
                                    String workflow,
                                    String currentStep,
                                    boolean finished) {
}
