package org.dpg.jobprocessor.service.techmeta;

import org.springframework.lang.Nullable;

/**
 * Title and caption embedded in a master image's IPTC headers by the scanning workstation.
 */
public record DescriptiveMetadata(String title, @Nullable String description) {
}
