package org.dpg.jobprocessor.dto.ocr;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Body of an OCR request: OCR all master files of a unit, or a single master file.
 */
public record OcrRequest(
        @NotNull @Pattern(regexp = "unit|masterfile", message = "must be 'unit' or 'masterfile'") String type,
        @NotNull @Positive Long id) {

    public boolean isUnit() {
        return "unit".equals(type);
    }
}
