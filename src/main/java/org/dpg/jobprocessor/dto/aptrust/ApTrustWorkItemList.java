package org.dpg.jobprocessor.dto.aptrust;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApTrustWorkItemList(long count, List<ApTrustWorkItem> results) {
}
