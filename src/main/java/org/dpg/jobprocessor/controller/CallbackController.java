package org.dpg.jobprocessor.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.dto.common.ApiResponse;
import org.dpg.jobprocessor.dto.ocr.OcrCallbackRequest;
import org.dpg.jobprocessor.service.ocr.OcrService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/callbacks")
@RequiredArgsConstructor
public class CallbackController implements CallbackApi {

    private final OcrService ocrService;

    @Override
    @PostMapping("/{jobId}/ocr")
    public ResponseEntity<ApiResponse<String>> ocrDone(@PathVariable final Long jobId,
                                                       @Valid @RequestBody final OcrCallbackRequest callback) {
        ocrService.handleCallback(jobId, callback);

        final ApiResponse<String> response = ApiResponse.<String>builder()
                                                        .response("ok")
                                                        .displayMessage("OCR callback received.")
                                                        .showMessage(false)
                                                        .statusCode(HttpStatus.OK.value())
                                                        .build();
        return ResponseEntity.ok(response);
    }
}
