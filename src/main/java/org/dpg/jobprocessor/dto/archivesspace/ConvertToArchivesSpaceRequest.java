package org.dpg.jobprocessor.dto.archivesspace;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Converts a metadata record into an external ArchivesSpace record.
 *
 * @param userId     staff member that asked for the conversion; the job is attributed to them.
 * @param metadataId record to convert.
 * @param asUrl      public URL of the archival object, e.g. {@code https://archives.lib.virginia.edu/repositories/3/archival_objects/1234}.
 */
public record ConvertToArchivesSpaceRequest(@NotNull @Positive Long userId,
                                            @NotNull @Positive Long metadataId,
                                            @NotBlank @JsonProperty("asURL") String asUrl) {
}
