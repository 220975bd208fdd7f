package org.dpg.jobprocessor.service.aptrust;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.aptrust.ApTrustApiClient;
import org.dpg.jobprocessor.common.processexec.ProcessExecutor;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.dto.aptrust.ApTrustWorkItem;
import org.dpg.jobprocessor.exception.JobProcessorException;
import org.dpg.jobprocessor.exception.ProcessExecutionException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.dpg.jobprocessor.model.ApTrustSubmission;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.Originator;
import org.dpg.jobprocessor.repository.ApTrustSubmissionRepository;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.storage.S3ObjectStore;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Submits the preservation bag of a metadata record to APTrust and reports its ingest status.
 * The bag itself is written by the external bagging tool into {@code app.processing.bag-dir}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApTrustSubmissionService {

    public static final String JOB_NAME = "APTrustSubmit";
    static final int MIN_PRESERVATION_TIER = 2;

    private final MetadataRepository metadataRepository;
    private final ApTrustSubmissionRepository submissionRepository;
    private final ApTrustApiClient apTrustApiClient;
    private final S3ObjectStore s3ObjectStore;
    private final ProcessExecutor processExecutor;
    private final JobStatusService jobStatusService;
    private final BackgroundJobRunner backgroundJobRunner;
    private final JobProcessingConfig config;

    public static String bagFileName(final Metadata metadata) {
        return "virginia.edu.tracksys-" + metadata.getType().getValue().toLowerCase(Locale.ROOT) + "-"
                + metadata.getId() + ".tar";
    }

    /**
     * Validates the request, then starts the submission job.
     *
     * @param resubmit send the bag even if the registry still has an open work item for it.
     * @return id of the submission job.
     */
    public Long submit(final long metadataId, final boolean resubmit) {
        final Metadata metadata = loadPreservable(metadataId);
        if (metadata.isCollection()) {
            // each item of a collection is bagged and submitted on its own
            throw new JobProcessorException("metadata " + metadataId + " is a collection; submit its items individually");
        }
        final ApTrustSubmission submission = prepare(metadata, resubmit);

        final JobStatus job = jobStatusService.create(JOB_NAME, Originator.metadata(metadataId));
        backgroundJobRunner.launch(job, running -> doSubmission(running, metadata, submission));
        return job.getId();
    }

    /**
     * Most recent registry work item of the record's bag.
     *
     * @throws ResourceNotFoundException if the record is unknown or the registry has no work item for it.
     */
    public ApTrustWorkItem status(final long metadataId) {
        final Metadata metadata = loadPreservable(metadataId);
        final String bag = submissionRepository.findByMetadataId(metadataId).map(ApTrustSubmission::getBag)
                                               .orElse(bagFileName(metadata));
        return apTrustApiClient.latestWorkItem(bag).orElseThrow(
                () -> new ResourceNotFoundException(metadataId + " has no aptrust status"));
    }

    ApTrustSubmission prepare(final Metadata metadata, final boolean resubmit) {
        final Optional<ApTrustSubmission> existing = submissionRepository.findByMetadataId(metadata.getId());
        if (existing.isEmpty()) {
            final ApTrustSubmission submission = new ApTrustSubmission();
            submission.setMetadataId(metadata.getId());
            submission.setBag(bagFileName(metadata));
            submission.setRequestedAt(LocalDateTime.now());
            return submissionRepository.save(submission);
        }
        if (!resubmit) {
            final Optional<ApTrustWorkItem> latest;
            try {
                latest = apTrustApiClient.latestWorkItem(existing.get().getBag());
            } catch (final ApiException e) {
                throw new JobProcessorException("aptrust status check failed for metadata " + metadata.getId()
                        + ": " + e.getMessage(), e);
            }
            if (latest.isPresent() && !latest.get().isResubmittable()) {
                throw new JobProcessorException("submission is already in progress for metadata " + metadata.getId()
                        + "; status " + latest.get().status());
            }
            if (latest.isEmpty()) {
                log.info("aptrust has no record of metadata {} submission, just resubmit", metadata.getId());
            }
        }
        return existing.get();
    }

    void doSubmission(final JobStatus job, final Metadata metadata, final ApTrustSubmission submission) {
        jobStatusService.logInfo(job, "Begin APTrust submission for metadata " + metadata.getId());
        final Path bag = Paths.get(config.getBagDir(), submission.getBag());
        try {
            if (!Files.exists(bag)) {
                throw new IOException("Bag " + bag + " does not exist");
            }
            jobStatusService.logInfo(job, "Validate bag " + bag);
            processExecutor.run(List.of("apt-cmd", "bag", "validate", "-p", "aptrust", bag.toString()),
                                "metadata " + metadata.getId(), "apt-cmd");

            jobStatusService.logInfo(job, "Submit " + bag + " to APTrust S3 bucket...");
            submission.setSubmittedAt(LocalDateTime.now());
            submission.setProcessedAt(null);
            submission.setSuccess(false);
            submissionRepository.save(submission);
            s3ObjectStore.upload(config.getAptrust().getReceivingBucket(), submission.getBag(), bag);
        } catch (final IOException | ProcessExecutionException | SdkException e) {
            log.error("APTrust submission of metadata {} failed", metadata.getId(), e);
            markProcessed(submission, false);
            jobStatusService.logFatal(job, "Metadata " + metadata.getId() + " APTrust submission failed: " + e.getMessage());
            return;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            jobStatusService.logFatal(job, "APTrust submission interrupted");
            return;
        }
        jobStatusService.logInfo(job, bag.getFileName() + " has been submitted to APTrust; check APTrust for ingest status");
    }

    private void markProcessed(final ApTrustSubmission submission, final boolean success) {
        submission.setSuccess(success);
        submission.setProcessedAt(LocalDateTime.now());
        submissionRepository.save(submission);
    }

    private Metadata loadPreservable(final long metadataId) {
        final Metadata metadata = metadataRepository.findById(metadataId).orElseThrow(
                () -> new ResourceNotFoundException("Metadata " + metadataId + " not found"));
        if (metadata.getPreservationTierId() == null || metadata.getPreservationTierId() < MIN_PRESERVATION_TIER) {
            throw new JobProcessorException("metadata " + metadataId + " has not been assigned for aptrust preservation");
        }
        return metadata;
    }
}
