package org.dpg.jobprocessor.service.ocr;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ocr.OcrApiClient;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.dto.ocr.OcrCallbackRequest;
import org.dpg.jobprocessor.dto.ocr.OcrRequest;
import org.dpg.jobprocessor.exception.OcrException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.Originator;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.job.JobTask;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits OCR requests and blocks the calling job until the OCR service calls back or the configured
 * timeout passes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OcrService {

    public static final String JOB_NAME = "OCR";

    private final OcrApiClient ocrApiClient;
    private final OcrRequestRegistry registry;
    private final JobStatusService jobStatusService;
    private final MasterFileRepository masterFileRepository;
    private final MetadataRepository metadataRepository;
    private final UnitRepository unitRepository;
    private final BackgroundJobRunner backgroundJobRunner;
    private final JobProcessingConfig config;

    /**
     * Starts a standalone OCR job for a unit or a single master file. The job fails if the OCR
     * service reports a failure or never calls back.
     *
     * @return id of the OCR job.
     * @throws ResourceNotFoundException if the unit or master file does not exist.
     */
    public Long startOcr(final OcrRequest request) {
        final long id = request.id();
        final Originator originator;
        final JobTask task;
        if (request.isUnit()) {
            final Unit unit = unitRepository.findById(id).orElseThrow(
                    () -> new ResourceNotFoundException("Unit " + id + " not found"));
            originator = Originator.unit(id);
            task = running -> runGuarded(running, () -> requestUnitOcr(running, unit));
        } else {
            if (!masterFileRepository.existsById(id)) {
                throw new ResourceNotFoundException("Master file " + id + " not found");
            }
            originator = Originator.masterFile(id);
            task = running -> runGuarded(running, () -> requestMasterFileOcr(running, id));
        }
        log.info("request for OCR on {}", originator);
        final JobStatus job = jobStatusService.create(JOB_NAME, originator);
        backgroundJobRunner.launch(job, task);
        return job.getId();
    }

    @FunctionalInterface
    private interface OcrCall {
        void run() throws OcrException, InterruptedException;
    }

    private void runGuarded(final JobStatus job, final OcrCall call) throws InterruptedException {
        try {
            call.run();
        } catch (final OcrException e) {
            jobStatusService.logFatal(job, "Unable to request OCR: " + e.getMessage());
        }
    }

    /**
     * OCRs every master file of the unit and waits for the result.
     *
     * @throws OcrException if the request is rejected, fails or times out.
     */
    public void requestUnitOcr(final JobStatus job, final Unit unit) throws OcrException, InterruptedException {
        jobStatusService.logInfo(job, "Requesting OCR for unit");
        final Metadata metadata = unit.getMetadata();
        if (metadata == null) {
            throw new OcrException("Unit " + unit.getId() + " has no metadata to OCR");
        }
        submitAndWait(job, metadata.getPid(), metadata.getOcrLanguageHint(), unit.getId());
    }

    /**
     * OCRs one master file and waits for the result.
     *
     * @throws OcrException if the request is rejected, fails or times out.
     */
    public void requestMasterFileOcr(final JobStatus job, final long masterFileId)
            throws OcrException, InterruptedException {
        jobStatusService.logInfo(job, "Requesting OCR for master file");
        final MasterFile masterFile = masterFileRepository.findById(masterFileId).orElseThrow(
                () -> new OcrException("Master file " + masterFileId + " not found"));
        if (masterFile.getMetadataId() == null) {
            throw new OcrException("Master file " + masterFileId + " has no metadata");
        }
        final Metadata metadata = metadataRepository.findById(masterFile.getMetadataId()).orElseThrow(
                () -> new OcrException("Metadata " + masterFile.getMetadataId() + " not found"));
        submitAndWait(job, masterFile.getPid(), metadata.getOcrLanguageHint(), null);
    }

    /**
     * Handles the OCR service's completion callback for a job. The pending wait is released whatever
     * happens here.
     *
     * @throws ResourceNotFoundException if the job does not exist.
     */
    public void handleCallback(final long jobId, final OcrCallbackRequest callback) {
        log.info("Received OCR done callback for job {}", jobId);
        try {
            final JobStatus job = jobStatusService.read(jobId);
            jobStatusService.logInfo(job, "Received OCR callback");
            if (callback.isSuccess()) {
                jobStatusService.logInfo(job, "OCR request completed successfully");
            } else {
                jobStatusService.logInfo(job, "OCR request failed: " + callback.message());
            }
        } finally {
            registry.complete(jobId, callback);
        }
    }

    private void submitAndWait(final JobStatus job, final String pid, final String language,
                               @Nullable final Long unitId) throws OcrException, InterruptedException {
        final String callbackUrl = callbackUrl(job.getId());
        final CompletableFuture<OcrCallbackRequest> result = registry.register(job.getId());
        try {
            jobStatusService.logInfo(job, "OCR request for " + pid + " (lang " + language + "), callback " + callbackUrl);
            ocrApiClient.requestOcr(pid, language, unitId, callbackUrl);
        } catch (final ApiException e) {
            registry.remove(job.getId());
            throw new OcrException("ocr request failed " + e.getStatusCode() + ":" + e.getMessage(), e);
        }
        jobStatusService.logInfo(job, "OCR Request successfully submitted. Awaiting results.");

        final Duration timeout = config.getOcr().getTimeout();
        final OcrCallbackRequest callback;
        try {
            callback = result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            registry.remove(job.getId());
            throw new OcrException("No OCR callback received within " + timeout.toMinutes() + " minutes");
        } catch (final ExecutionException e) {
            throw new OcrException("OCR wait failed: " + e.getCause().getMessage(), e.getCause());
        } catch (final InterruptedException e) {
            registry.remove(job.getId());
            throw e;
        }

        if (!callback.isSuccess()) {
            throw new OcrException("OCR request failed: " + callback.message());
        }
        jobStatusService.logInfo(job, "OCR request finished");
    }

    private String callbackUrl(final long jobId) {
        return config.getServiceUrl() + "/api/v1/callbacks/" + jobId + "/ocr";
    }
}
