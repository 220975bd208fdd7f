package org.dpg.jobprocessor.service.finalization;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.exception.ExtractionException;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.exception.ProcessExecutionException;
import org.dpg.jobprocessor.model.ImageTechMeta;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.ImageTechMetaRepository;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.archive.ArchiveStore;
import org.dpg.jobprocessor.service.archive.FileSystemArchiveStore;
import org.dpg.jobprocessor.service.archive.OrderArchiveChecker;
import org.dpg.jobprocessor.service.catalog.CatalogMetadataService;
import org.dpg.jobprocessor.service.deliverable.PatronDeliverableService;
import org.dpg.jobprocessor.service.deliverable.PatronDeliverableService.NoticeContext;
import org.dpg.jobprocessor.service.iiif.IiifStore;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.techmeta.DescriptiveMetadata;
import org.dpg.jobprocessor.service.techmeta.TechMetadataExtractor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Import phase of finalization. Runs in three passes over the staged images:
 * <ol>
 *     <li>create or load the master file record and its technical metadata, one image at a time;</li>
 *     <li>publish the IIIF derivatives in parallel batches on the {@code iiifTaskExecutor};</li>
 *     <li>archive each original, render its patron copy and attach its transcription.</li>
 * </ol>
 * Every step checks what is already there, so a retried finalization only redoes what is missing.
 * An image whose technical metadata cannot be read stops the phase before anything is published or archived.
 */
@Slf4j
@Service
public class ImageImportService {

    private final JobStatusService jobStatusService;
    private final TechMetadataExtractor techMetadataExtractor;
    private final IiifStore iiifStore;
    private final ArchiveStore archiveStore;
    private final PatronDeliverableService patronDeliverableService;
    private final CatalogMetadataService catalogMetadataService;
    private final OrderArchiveChecker orderArchiveChecker;
    private final WorkDirectoryService workDirectoryService;
    private final MasterFileRepository masterFileRepository;
    private final ImageTechMetaRepository imageTechMetaRepository;
    private final UnitRepository unitRepository;
    private final AsyncTaskExecutor iiifTaskExecutor;
    private final JobProcessingConfig config;

    public ImageImportService(final JobStatusService jobStatusService,
                              final TechMetadataExtractor techMetadataExtractor,
                              final IiifStore iiifStore,
                              final ArchiveStore archiveStore,
                              final PatronDeliverableService patronDeliverableService,
                              final CatalogMetadataService catalogMetadataService,
                              final OrderArchiveChecker orderArchiveChecker,
                              final WorkDirectoryService workDirectoryService,
                              final MasterFileRepository masterFileRepository,
                              final ImageTechMetaRepository imageTechMetaRepository,
                              final UnitRepository unitRepository,
                              @Qualifier("iiifTaskExecutor") final AsyncTaskExecutor iiifTaskExecutor,
                              final JobProcessingConfig config) {
        this.jobStatusService = jobStatusService;
        this.techMetadataExtractor = techMetadataExtractor;
        this.iiifStore = iiifStore;
        this.archiveStore = archiveStore;
        this.patronDeliverableService = patronDeliverableService;
        this.catalogMetadataService = catalogMetadataService;
        this.orderArchiveChecker = orderArchiveChecker;
        this.workDirectoryService = workDirectoryService;
        this.masterFileRepository = masterFileRepository;
        this.imageTechMetaRepository = imageTechMetaRepository;
        this.unitRepository = unitRepository;
        this.iiifTaskExecutor = iiifTaskExecutor;
        this.config = config;
    }

    /**
     * A staged image with its master file record. {@code techMeta} is null when extraction failed.
     */
    record ImportedImage(StagedImage image, MasterFile masterFile, ImageTechMeta techMeta) {
    }

    /**
     * Imports the staged images of a unit.
     *
     * @return the number of master files imported.
     */
    public int importImages(final JobStatus job, final Unit unit, final List<StagedImage> images)
            throws FinalizationException {
        jobStatusService.logInfo(job, "Import " + images.size() + " images from "
                + workDirectoryService.finalizationDir(unit.getId()));

        final List<ImportedImage> imported = new ArrayList<>(images.size());
        for (final StagedImage image : images) {
            imported.add(loadOrCreateMasterFile(job, unit, image));
        }
        final List<String> unreadable = imported.stream()
                                                .filter(entry -> entry.techMeta() == null)
                                                .map(entry -> entry.image().filename())
                                                .collect(Collectors.toList());
        if (!unreadable.isEmpty()) {
            throw new FinalizationException("Missing image tech metadata for " + unreadable.size()
                    + " images: " + String.join(", ", unreadable));
        }
        if (unit.isReorder()) {
            jobStatusService.logInfo(job, "Unit is a reorder; only master file records were created");
            return imported.size();
        }

        publishDerivatives(job, imported);

        final boolean perFileDeliverables = !unit.isDigitalCollectionBuilding()
                && !unit.getIntendedUse().isPdfDeliverable();
        final Path assembleDir = perFileDeliverables ? prepareAssembleDir(unit) : null;
        final NoticeContext notice = perFileDeliverables ? noticeContext(unit.getMetadata()) : NoticeContext.none();
        final boolean archiveUnit = !unit.isThrowAway() && unit.getDateArchived() == null;

        for (final ImportedImage entry : imported) {
            if (archiveUnit && entry.masterFile().getDateArchived() == null) {
                archive(job, unit, entry);
            }
            if (perFileDeliverables) {
                patronDeliverableService.createFileDeliverable(job, unit, entry.masterFile(), entry.techMeta(),
                                                               entry.image().path(), assembleDir, notice);
            }
            attachTranscription(job, entry);
        }

        jobStatusService.logInfo(job, imported.size() + " master files ingested");
        final LocalDateTime now = LocalDateTime.now();
        unitRepository.markArchived(unit.getId(), imported.size(), now);
        unit.setMasterFilesCount(imported.size());
        unit.setDateArchived(now);
        orderArchiveChecker.checkOrderArchiveComplete(job, unit.getOrder().getId());
        jobStatusService.logInfo(job, "Images for Unit successfully imported.");
        return imported.size();
    }

    ImportedImage loadOrCreateMasterFile(final JobStatus job, final Unit unit, final StagedImage image)
            throws FinalizationException {
        final DescriptiveMetadata descriptive;
        try {
            descriptive = techMetadataExtractor.extractDescriptive(image.path());
        } catch (final ExtractionException e) {
            throw new FinalizationException(e.getMessage(), e);
        }

        MasterFile masterFile = masterFileRepository.findFirstByFilename(image.filename()).orElse(null);
        if (masterFile == null) {
            jobStatusService.logInfo(job, "Create new master file " + image.filename());
            final String md5;
            try {
                md5 = FileSystemArchiveStore.md5(image.path());
            } catch (final IOException e) {
                throw new FinalizationException("Unable to checksum " + image.path() + ": " + e.getMessage(), e);
            }
            masterFile = masterFileRepository.save(MasterFile.builder()
                                                             .unitId(unit.getId())
                                                             .metadataId(unit.getMetadata().getId())
                                                             .filename(image.filename())
                                                             .filesize(image.size())
                                                             .md5(md5)
                                                             .title(descriptive.title())
                                                             .description(descriptive.description())
                                                             .build());
            masterFile.setPid(MasterFile.pidFor(masterFile.getId()));
            masterFile = masterFileRepository.save(masterFile);
        } else {
            jobStatusService.logInfo(job, "Master file " + image.filename() + " already exists");
        }

        ImageTechMeta techMeta = imageTechMetaRepository.findFirstByMasterFileId(masterFile.getId()).orElse(null);
        if (techMeta == null) {
            try {
                techMeta = imageTechMetaRepository.save(techMetadataExtractor.extract(image.path(), masterFile.getId()));
            } catch (final ExtractionException e) {
                jobStatusService.logError(job, "Unable to create image tech metadata: " + e.getMessage());
            }
        }
        return new ImportedImage(image, masterFile, techMeta);
    }

    /**
     * Publishes the IIIF derivatives in batches of {@code iiifBatchSize}. Waits for every batch, then
     * fails if any image could not be published.
     */
    void publishDerivatives(final JobStatus job, final List<ImportedImage> imported) throws FinalizationException {
        final int batchSize = Math.max(1, config.getFinalization().getIiifBatchSize());
        final List<List<ImportedImage>> batches = new ArrayList<>();
        for (int i = 0; i < imported.size(); i += batchSize) {
            batches.add(imported.subList(i, Math.min(i + batchSize, imported.size())));
        }
        jobStatusService.logInfo(job, "Publish " + imported.size() + " IIIF derivatives in " + batches.size() + " batches");

        final Queue<String> errors = new ConcurrentLinkedQueue<>();
        final List<CompletableFuture<Void>> futures = batches.stream()
                .map(batch -> CompletableFuture.runAsync(() -> publishBatch(job, batch, errors), iiifTaskExecutor))
                .collect(Collectors.toList());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (final CompletionException e) {
            log.error("Job ID {}: IIIF batch failed", job.getId(), e.getCause());
            errors.add(e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new FinalizationException("IIIF publish failed: " + errors.peek());
        }
    }

    private void publishBatch(final JobStatus job, final List<ImportedImage> batch, final Queue<String> errors) {
        for (final ImportedImage entry : batch) {
            final MasterFile masterFile = entry.masterFile();
            try {
                if (!iiifStore.publish(entry.image().path(), masterFile.getPid(), entry.techMeta().getImageFormat(),
                                       false)) {
                    log.debug("Job ID {}: IIIF derivative for {} already exists", job.getId(), masterFile.getPid());
                }
            } catch (final IOException | ProcessExecutionException e) {
                final String msg = masterFile.getFilename() + ": " + e.getMessage();
                jobStatusService.logError(job, "Unable to publish IIIF derivative for " + msg);
                errors.add(msg);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.add(masterFile.getFilename() + ": interrupted");
                return;
            }
        }
    }

    private void archive(final JobStatus job, final Unit unit, final ImportedImage entry) throws FinalizationException {
        final MasterFile masterFile = entry.masterFile();
        final String md5;
        try {
            md5 = archiveStore.put(entry.image().path(), unit.getId(), masterFile.getFilename());
        } catch (final IOException e) {
            throw new FinalizationException("Archive failed: " + e.getMessage(), e);
        }
        if (!md5.equals(masterFile.getMd5())) {
            jobStatusService.logError(job, "Archive MD5 does not match source MD5 for " + masterFile.getFilename());
        }
        masterFile.setDateArchived(LocalDateTime.now());
        masterFileRepository.save(masterFile);
    }

    private void attachTranscription(final JobStatus job, final ImportedImage entry) {
        final Path transcription = entry.image().transcriptionPath();
        if (!Files.exists(transcription)) {
            return;
        }
        try {
            final MasterFile masterFile = entry.masterFile();
            masterFile.setTranscriptionText(Files.readString(transcription, StandardCharsets.UTF_8));
            masterFileRepository.save(masterFile);
        } catch (final IOException e) {
            jobStatusService.logError(job, "Unable to read transcription " + transcription + ": " + e.getMessage());
        }
    }

    private Path prepareAssembleDir(final Unit unit) throws FinalizationException {
        try {
            return workDirectoryService.ensureAssembleDir(unit.getId());
        } catch (final IOException e) {
            throw new FinalizationException("Unable to create assemble directory: " + e.getMessage(), e);
        }
    }

    private NoticeContext noticeContext(final Metadata metadata) {
        if (metadata.getType() != MetadataType.SIRSI) {
            return NoticeContext.none();
        }
        final String callNumber = metadata.getCallNumber() == null ? "" : metadata.getCallNumber();
        return new NoticeContext(callNumber, catalogMetadataService.location(metadata));
    }
}
