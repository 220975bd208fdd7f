package org.dpg.jobprocessor.service.finalization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.exception.OcrException;
import org.dpg.jobprocessor.exception.OrderNotReadyException;
import org.dpg.jobprocessor.exception.PublicationException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.deliverable.PatronDeliverableService;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.ocr.OcrService;
import org.dpg.jobprocessor.service.order.OrderDeliveryService;
import org.dpg.jobprocessor.service.project.ProjectCompletionValidator;
import org.dpg.jobprocessor.service.project.ProjectNotifier;
import org.dpg.jobprocessor.service.publish.DiscoveryPublishService;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The phases of a unit finalization run, in order. The unit has already been claimed
 * ({@code finalizing}) by {@link UnitFinalizationService}. A failed phase stops the run; OCR,
 * publication and order-readiness problems are only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnitFinalizationWorkflow {

    private final UnitRepository unitRepository;
    private final OrderRepository orderRepository;
    private final JobStatusService jobStatusService;
    private final WorkDirectoryService workDirectoryService;
    private final UnitQaService unitQaService;
    private final FilesystemQaService filesystemQaService;
    private final ImageImportService imageImportService;
    private final OcrService ocrService;
    private final DiscoveryPublishService discoveryPublishService;
    private final PatronDeliverableService patronDeliverableService;
    private final OrderDeliveryService orderDeliveryService;
    private final ProjectCompletionValidator projectCompletionValidator;
    private final ProjectNotifier projectNotifier;
    private final FinalizationFailureHandler failureHandler;

    /**
     * Runs the finalization. A phase failure is handled here; anything else propagates to the job runner.
     *
     * @param priorStatus status the unit had before it was claimed.
     */
    public void run(final JobStatus job, final long unitId, final UnitStatus priorStatus) {
        try {
            finalizeUnit(job, unitId, priorStatus);
        } catch (final FinalizationException e) {
            log.warn("Job ID {}: finalization of unit {} failed: {}", job.getId(), unitId, e.getMessage());
            failureHandler.failUnit(job, unitId, e.getMessage());
        }
    }

    void finalizeUnit(final JobStatus job, final long unitId, final UnitStatus priorStatus) throws FinalizationException {
        final Path srcDir = workDirectoryService.finalizationDir(unitId);
        if (!Files.isDirectory(srcDir)) {
            throw new FinalizationException(String.format("Finalization directory %s does not exist.", srcDir));
        }

        final Unit unit = loadUnit(unitId);
        if (priorStatus == UnitStatus.APPROVED) {
            jobStatusService.logInfo(job, "Start finalization of unit " + unitId);
            final Order order = unit.getOrder();
            order.setDateFinalizationBegun(LocalDateTime.now());
            orderRepository.save(order);
        } else {
            jobStatusService.logInfo(job, "Restart finalization of unit " + unitId);
        }
        jobStatusService.logInfo(job, "Unit " + unitId + " status is " + UnitStatus.FINALIZING.getValue());

        unitQaService.qaUnit(job, unit);
        filesystemQaService.qaFilesystem(job, unitId, srcDir);

        final List<StagedImage> images;
        try {
            images = filesystemQaService.listImages(srcDir, unitId);
        } catch (final IOException e) {
            throw new FinalizationException("Unable to list images in " + srcDir + ": " + e.getMessage(), e);
        }
        imageImportService.importImages(job, unit, images);

        if (unit.isOcrMasterFiles()) {
            requestOcr(job, unit);
        }
        if (unit.isIncludeInDl()) {
            publish(job, unit);
        }
        if (!unit.isDigitalCollectionBuilding()) {
            patronDeliverableService.generateUnitDeliverables(job, unit, images);
            try {
                orderDeliveryService.checkReadyForDelivery(job, unit.getOrder().getId());
            } catch (final OrderNotReadyException e) {
                jobStatusService.logError(job, e.getMessage());
            }
        }

        final Unit finished = loadUnit(unitId);
        projectCompletionValidator.validate(job, finished);
        unitRepository.updateStatus(unitId, UnitStatus.DONE);
        final long minutes = FinalizationFailureHandler.processingMinutes(job);
        jobStatusService.logInfo(job, "Total finalization minutes: " + minutes);
        projectNotifier.finalizationSucceeded(job, unitId, minutes);

        workDirectoryService.cleanup(job, unitId);
    }

    private void requestOcr(final JobStatus job, final Unit unit) throws FinalizationException {
        jobStatusService.logInfo(job, "OCR was requested for this unit");
        try {
            ocrService.requestUnitOcr(job, unit);
        } catch (final OcrException e) {
            jobStatusService.logError(job, "Unable to OCR unit: " + e.getMessage());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FinalizationException("Interrupted while waiting for OCR", e);
        }
    }

    /**
     * An unsupported metadata type is logged as a job error by the publish service.
     */
    private void publish(final JobStatus job, final Unit unit) {
        try {
            discoveryPublishService.publish(job, unit.getMetadata());
        } catch (final PublicationException e) {
            log.warn("Job ID {}: publication of unit {} failed: {}", job.getId(), unit.getId(), e.getMessage());
        }
    }

    private Unit loadUnit(final long unitId) throws FinalizationException {
        return unitRepository.findById(unitId)
                             .orElseThrow(() -> new FinalizationException("Unit " + unitId + " not found"));
    }
}
