package org.dpg.jobprocessor.service.publish;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.iiif.IiifManifestApiClient;
import org.dpg.jobprocessor.common.apiclient.reindex.ReindexApiClient;
import org.dpg.jobprocessor.exception.JobProcessorException;
import org.dpg.jobprocessor.exception.PublicationException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.Originator;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Publishes a metadata record and its images to the discovery system (Virgo): regenerates the IIIF
 * manifest, stamps the DL ingest/update dates and asks the indexer to reindex the record.
 * <p>
 * Problems are logged as job errors and then thrown; callers decide whether they are fatal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryPublishService {

    public static final String JOB_NAME = "PublishToVirgo";

    private final UnitRepository unitRepository;
    private final MasterFileRepository masterFileRepository;
    private final MetadataRepository metadataRepository;
    private final IiifManifestApiClient iiifManifestApiClient;
    private final ReindexApiClient reindexApiClient;
    private final JobStatusService jobStatusService;
    private final BackgroundJobRunner backgroundJobRunner;

    /**
     * Starts a standalone publication of a metadata record.
     *
     * @return id of the publication job.
     * @throws ResourceNotFoundException if the record does not exist.
     * @throws JobProcessorException     if the record type cannot be published.
     */
    public Long startPublish(final long metadataId) {
        final Metadata metadata = metadataRepository.findById(metadataId).orElseThrow(
                () -> new ResourceNotFoundException("Unable to find metadata " + metadataId));
        if (!isPublishable(metadata)) {
            throw new JobProcessorException("This metadata is [" + metadata.getType().getValue()
                    + "] and not a candidate for publication");
        }
        final JobStatus job = jobStatusService.create(JOB_NAME, Originator.metadata(metadataId));
        backgroundJobRunner.launch(job, running -> {
            jobStatusService.logInfo(running, "Publish metadata " + metadataId + " to Virgo");
            try {
                publish(running, metadata);
            } catch (final PublicationException e) {
                log.warn("Job ID {}: publication of metadata {} failed: {}", running.getId(), metadataId, e.getMessage());
                jobStatusService.logFatal(running, "Publication failed");
            }
        });
        return job.getId();
    }

    public boolean isPublishable(final Metadata metadata) {
        return metadata.getType() == MetadataType.SIRSI || metadata.getType() == MetadataType.XML;
    }

    public void publish(final JobStatus job, final Metadata metadata) throws PublicationException {
        switch (metadata.getType()) {
            case SIRSI -> publishSirsi(job, metadata);
            case XML -> publishXml(job, metadata);
            default -> {
                final String msg = "Metadata " + metadata.getId() + " type " + metadata.getType().getValue()
                        + " is not supported for publication";
                jobStatusService.logError(job, msg);
                throw new PublicationException(msg);
            }
        }
    }

    void publishSirsi(final JobStatus job, final Metadata metadata) throws PublicationException {
        jobStatusService.logInfo(job, "Publish Sirsi metadata to Virgo");
        if (!StringUtils.hasText(metadata.getCatalogKey())) {
            throw fail(job, "Publish to Virgo failed: metadata " + metadata.getId() + " is missing a catalog key.");
        }
        if (metadata.getAvailabilityPolicyId() == null) {
            throw fail(job, "Publish to Virgo failed: metadata " + metadata.getId()
                    + " is missing the required availability policy.");
        }

        final List<Unit> dlUnits = unitRepository.findByMetadata_IdAndIncludeInDlTrue(metadata.getId());
        if (dlUnits.size() > 1) {
            throw fail(job, "Too many units flagged for inclusion in DL");
        }
        if (dlUnits.isEmpty()) {
            throw fail(job, "No unit of metadata " + metadata.getId() + " is flagged for inclusion in DL");
        }
        final Unit unit = dlUnits.get(0);
        jobStatusService.logInfo(job, "Unit " + unit.getId() + " will be published to DL");

        refreshManifest(job, metadata.getPid());
        final LocalDateTime now = LocalDateTime.now();
        stampMetadata(job, metadata, now);
        final List<MasterFile> masterFiles = masterFileRepository.findByUnitIdOrderByFilenameAsc(unit.getId());
        stampMasterFiles(masterFiles, now);

        jobStatusService.logInfo(job, "Call the reindex service for " + metadata.getId() + " - " + metadata.getCatalogKey());
        try {
            reindexApiClient.reindexCatalogRecord(metadata.getCatalogKey());
        } catch (final ApiException e) {
            throw fail(job, metadata.getCatalogKey() + " reindex request failed: " + e.getStatusCode() + ": " + e.getMessage());
        }
        jobStatusService.logInfo(job, metadata.getCatalogKey() + " reindex request successful");

        markDlDeliverablesReady(job, unit, now);
        jobStatusService.logInfo(job, "Unit and " + masterFiles.size() + " master files have been published to the DL");
    }

    void publishXml(final JobStatus job, final Metadata metadata) throws PublicationException {
        jobStatusService.logInfo(job, "Call the XML reindex service for " + metadata.getPid());

        final List<Unit> dlUnits = unitRepository.findByMetadata_IdAndIncludeInDlTrue(metadata.getId());
        if (dlUnits.size() > 1) {
            throw fail(job, "Too many units flagged for inclusion in DL");
        }

        final Unit unit;
        final List<MasterFile> masterFiles;
        if (dlUnits.isEmpty()) {
            // XML metadata added to individual master files after ingest has no direct unit link
            jobStatusService.logInfo(job, "No units found for metadata " + metadata.getId() + ", looking for master files");
            final Optional<UnitMasterFiles> found = findUnitThroughMasterFiles(job, metadata);
            if (found.isEmpty()) {
                throw fail(job, "No units suitable for publication found.");
            }
            unit = found.get().unit();
            masterFiles = found.get().masterFiles();
        } else {
            unit = dlUnits.get(0);
            masterFiles = masterFileRepository.findByMetadataIdAndUnitId(metadata.getId(), unit.getId());
        }
        jobStatusService.logInfo(job, masterFiles.size() + " masterfiles from unit " + unit.getId()
                + " will be published to DL");

        refreshManifest(job, metadata.getPid());
        final LocalDateTime now = LocalDateTime.now();
        stampMetadata(job, metadata, now);
        stampMasterFiles(masterFiles, now);

        try {
            reindexApiClient.reindexXmlRecord(metadata.getId());
        } catch (final ApiException e) {
            throw fail(job, "XML " + metadata.getPid() + " reindex request failed: " + e.getStatusCode() + ": "
                    + e.getMessage());
        }
        markDlDeliverablesReady(job, unit, now);
        jobStatusService.logInfo(job, "XML " + metadata.getPid() + " reindex request successful");
    }

    private Optional<UnitMasterFiles> findUnitThroughMasterFiles(final JobStatus job, final Metadata metadata)
            throws PublicationException {
        Unit unit = null;
        final List<MasterFile> selected = new ArrayList<>();
        for (final MasterFile masterFile : masterFileRepository.findByMetadataId(metadata.getId())) {
            final Optional<Unit> mfUnit = unitRepository.findById(masterFile.getUnitId());
            if (mfUnit.isEmpty() || !mfUnit.get().isIncludeInDl()) {
                continue;
            }
            if (unit == null) {
                unit = mfUnit.get();
            } else if (!unit.getId().equals(mfUnit.get().getId())) {
                throw fail(job, "Too many units flagged for inclusion in DL found");
            }
            selected.add(masterFile);
        }
        return unit == null ? Optional.empty() : Optional.of(new UnitMasterFiles(unit, selected));
    }

    private void refreshManifest(final JobStatus job, final String pid) throws PublicationException {
        jobStatusService.logInfo(job, "Generating IIIF manifest for " + pid);
        try {
            iiifManifestApiClient.refreshManifest(pid);
        } catch (final ApiException e) {
            throw fail(job, "Unable to generate IIIF manifest: " + e.getStatusCode() + ": " + e.getMessage());
        }
        jobStatusService.logInfo(job, "IIIF manifest successfully generated");
    }

    private void stampMetadata(final JobStatus job, final Metadata metadata, final LocalDateTime now) {
        if (metadata.getDateDlIngest() == null) {
            metadata.setDateDlIngest(now);
            jobStatusService.logInfo(job, "Set DateDlIngest for metadata record " + metadata.getId());
        } else {
            metadata.setDateDlUpdate(now);
            jobStatusService.logInfo(job, "Set DateDlUpdate for metadata record " + metadata.getId());
        }
        try {
            metadataRepository.save(metadata);
        } catch (final RuntimeException e) {
            log.error("Unable to stamp DL dates of metadata {}", metadata.getId(), e);
            jobStatusService.logError(job, "Unable to update DL dates of metadata " + metadata.getId() + ": " + e.getMessage());
        }
    }

    private void stampMasterFiles(final List<MasterFile> masterFiles, final LocalDateTime now) {
        for (final MasterFile masterFile : masterFiles) {
            if (masterFile.getDateDlIngest() == null) {
                masterFile.setDateDlIngest(now);
            } else {
                masterFile.setDateDlUpdate(now);
            }
        }
        masterFileRepository.saveAll(masterFiles);
    }

    private void markDlDeliverablesReady(final JobStatus job, final Unit unit, final LocalDateTime now) {
        if (unitRepository.markDlDeliverablesReady(unit.getId(), now) == 1) {
            unit.setDateDlDeliverablesReady(now);
            jobStatusService.logInfo(job, "Set date unit deliverables ready");
        }
    }

    private PublicationException fail(final JobStatus job, final String message) {
        jobStatusService.logError(job, message);
        return new PublicationException(message);
    }

    private record UnitMasterFiles(Unit unit, List<MasterFile> masterFiles) {
    }
}
