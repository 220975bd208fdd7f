package org.dpg.jobprocessor.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.dto.aptrust.ApTrustWorkItem;
import org.dpg.jobprocessor.dto.archivesspace.ConvertToArchivesSpaceRequest;
import org.dpg.jobprocessor.dto.common.ApiResponse;
import org.dpg.jobprocessor.dto.ocr.OcrRequest;
import org.dpg.jobprocessor.service.aptrust.ApTrustSubmissionService;
import org.dpg.jobprocessor.service.archivesspace.ArchivesSpaceConversionService;
import org.dpg.jobprocessor.service.finalization.UnitFinalizationService;
import org.dpg.jobprocessor.service.ocr.OcrService;
import org.dpg.jobprocessor.service.order.OrderDeliveryService;
import org.dpg.jobprocessor.service.publish.DiscoveryPublishService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts the background jobs of the digitization workflow. Input is validated before a job is
 * created; every successful call answers with the new job's ID.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class WorkflowController implements WorkflowApi {

    private static final String POSITIVE_ID = "ID must be a positive number.";

    private final UnitFinalizationService unitFinalizationService;
    private final OcrService ocrService;
    private final OrderDeliveryService orderDeliveryService;
    private final DiscoveryPublishService discoveryPublishService;
    private final ApTrustSubmissionService apTrustSubmissionService;
    private final ArchivesSpaceConversionService archivesSpaceConversionService;

    @Override
    @PostMapping("/units/{unitId}/finalize")
    public ResponseEntity<ApiResponse<Long>> finalizeUnit(@PathVariable @Positive(message = POSITIVE_ID) final Long unitId) {
        log.info("Finalization requested for unit {}", unitId);
        final Long jobId = unitFinalizationService.startFinalization(unitId);
        return jobStarted(jobId, "Finalization of unit " + unitId + " started.");
    }

    @Override
    @PostMapping("/ocr")
    public ResponseEntity<ApiResponse<Long>> requestOcr(@Valid @RequestBody final OcrRequest request) {
        log.info("OCR requested for {} {}", request.type(), request.id());
        final Long jobId = ocrService.startOcr(request);
        return jobStarted(jobId, "OCR of " + request.type() + " " + request.id() + " requested.");
    }

    @Override
    @PostMapping("/orders/{orderId}/check")
    public ResponseEntity<ApiResponse<Long>> checkOrder(@PathVariable @Positive(message = POSITIVE_ID) final Long orderId) {
        log.info("Delivery check requested for order {}", orderId);
        final Long jobId = orderDeliveryService.startCheck(orderId);
        return jobStarted(jobId, "Delivery check of order " + orderId + " started.");
    }

    @Override
    @PostMapping("/metadata/{metadataId}/publish")
    public ResponseEntity<ApiResponse<Long>> publishToVirgo(
            @PathVariable @Positive(message = POSITIVE_ID) final Long metadataId) {
        log.info("Publication requested for metadata {}", metadataId);
        final Long jobId = discoveryPublishService.startPublish(metadataId);
        return jobStarted(jobId, "Publication of metadata " + metadataId + " started.");
    }

    @Override
    @PostMapping("/metadata/{metadataId}/aptrust")
    public ResponseEntity<ApiResponse<Long>> submitToApTrust(
            @PathVariable @Positive(message = POSITIVE_ID) final Long metadataId,
            @RequestParam(value = "resubmit", defaultValue = "false") final boolean resubmit) {
        log.info("APTrust submission requested for metadata {} (resubmit: {})", metadataId, resubmit);
        final Long jobId = apTrustSubmissionService.submit(metadataId, resubmit);
        return jobStarted(jobId, "APTrust submission of metadata " + metadataId + " started.");
    }

    @Override
    @GetMapping("/metadata/{metadataId}/aptrust")
    public ResponseEntity<ApiResponse<ApTrustWorkItem>> getApTrustStatus(
            @PathVariable @Positive(message = POSITIVE_ID) final Long metadataId) {
        final ApTrustWorkItem status = apTrustSubmissionService.status(metadataId);

        final ApiResponse<ApTrustWorkItem> response = ApiResponse.<ApTrustWorkItem>builder()
                                                                 .response(status)
                                                                 .displayMessage("APTrust status retrieved successfully.")
                                                                 .showMessage(true)
                                                                 .statusCode(HttpStatus.OK.value())
                                                                 .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @PostMapping("/archivesspace/convert")
    public ResponseEntity<ApiResponse<Long>> convertToArchivesSpace(
            @Valid @RequestBody final ConvertToArchivesSpaceRequest request) {
        log.info("ArchivesSpace conversion of metadata {} to {} requested by {}", request.metadataId(),
                 request.asUrl(), request.userId());
        final Long jobId = archivesSpaceConversionService.startConversion(request);
        return jobStarted(jobId, "Conversion of metadata " + request.metadataId() + " started.");
    }

    private static ResponseEntity<ApiResponse<Long>> jobStarted(final Long jobId, final String message) {
        final ApiResponse<Long> response = ApiResponse.<Long>builder()
                                                      .response(jobId)
                                                      .displayMessage(message)
                                                      .showMessage(true)
                                                      .statusCode(HttpStatus.OK.value())
                                                      .build();
        return ResponseEntity.ok(response);
    }
}
