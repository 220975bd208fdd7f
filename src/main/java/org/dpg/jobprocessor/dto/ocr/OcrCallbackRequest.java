package org.dpg.jobprocessor.dto.ocr;

import jakarta.validation.constraints.NotBlank;

/**
 * Sent by the OCR service when it has finished a request. Any status other than {@code success}
 * is a failure and {@code message} says why.
 */
public record OcrCallbackRequest(@NotBlank String status, String message) {

    public boolean isSuccess() {
        return "success".equalsIgnoreCase(status);
    }
}
