package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "intended_uses")
@Data
public class IntendedUse {

    /**
     * Intended use of units digitized for the digital collection only; these get no patron deliverables.
     */
    public static final long DIGITAL_COLLECTION_BUILDING = 110L;

    @Id
    private Long id;

    private String description;

    /**
     * "pdf", "jpeg" or "tiff".
     */
    private String deliverableFormat;

    /**
     * Target resolution in dpi, "Highest Possible", or empty.
     */
    private String deliverableResolution;

    @Transient
    public boolean isPdfDeliverable() {
        return "pdf".equalsIgnoreCase(deliverableFormat);
    }
}
