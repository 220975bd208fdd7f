package org.dpg.jobprocessor.dto.aptrust;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ingest work item of the preservation registry. {@code status} is e.g. {@code Pending},
 * {@code Started}, {@code Success}, {@code Failed}, {@code Canceled}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApTrustWorkItem(Long id,
                              String name,
                              String etag,
                              @JsonProperty("object_identifier") String objectIdentifier,
                              @JsonProperty("bag_group_identifier") String groupIdentifier,
                              @JsonProperty("storage_option") String storageOption,
                              String note,
                              String status,
                              @JsonProperty("date_processed") String processedAt) {

    @JsonIgnore
    public boolean isResubmittable() {
        return "Failed".equals(status) || "Canceled".equals(status);
    }
}
