package org.dpg.jobprocessor.dto.iiif;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IiifManifestStatus(boolean exists, boolean cached, String url) {
}
