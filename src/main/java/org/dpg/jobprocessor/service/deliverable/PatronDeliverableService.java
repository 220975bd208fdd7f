package org.dpg.jobprocessor.service.deliverable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.dpg.jobprocessor.common.processexec.ProcessExecutor;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.exception.ProcessExecutionException;
import org.dpg.jobprocessor.model.ImageTechMeta;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.finalization.StagedImage;
import org.dpg.jobprocessor.service.finalization.WorkDirectoryService;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds the files a patron receives for a unit: per-image JPEG or TIFF renditions zipped into the
 * order's delivery directory, or one PDF of the whole unit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatronDeliverableService {

    static final long MAX_ZIP_BYTES = 2L * 1024 * 1024 * 1024;
    static final int MAX_NOTICE_TITLE = 145;

    /**
     * Web publication and online exhibit uses get no watermark.
     */
    private static final Set<Long> UNWATERMARKED_USES = Set.of(103L, 109L);
    private static final Set<Long> PRIVATE_STUDY_USES = Set.of(104L, 106L);
    private static final long CLASSROOM_USE = 100L;

    private static final String PRIVATE_STUDY_NOTICE = "This single copy was produced for the purposes of private "
            + "study, scholarship, or research pursuant to 17 USC § 107 and/or 108.\nCopyright and other legal "
            + "restrictions may apply to further uses. Special Collections, University of Virginia Library.";
    private static final String CLASSROOM_NOTICE = "This single copy was produced for the purposes of classroom "
            + "teaching pursuant to 17 USC § 107 (fair use).\nCopyright and other legal restrictions may apply to "
            + "further uses. Special Collections, University of Virginia Library.";

    private final ProcessExecutor processExecutor;
    private final WorkDirectoryService workDirectoryService;
    private final MasterFileRepository masterFileRepository;
    private final UnitRepository unitRepository;
    private final JobStatusService jobStatusService;

    /**
     * Watermark text and placement inputs for JPEG deliverables.
     *
     * @param callNumber catalog call number, may be empty.
     * @param location   shelf location from the catalog record, may be empty.
     */
    public record NoticeContext(String callNumber, String location) {
        public static NoticeContext none() {
            return new NoticeContext("", "");
        }
    }

    /**
     * Renders the patron copy of one master image into the assemble directory. An existing rendition is kept.
     */
    public void createFileDeliverable(final JobStatus job, final Unit unit, final MasterFile masterFile,
                                      final ImageTechMeta techMeta, final Path source, final Path assembleDir,
                                      final NoticeContext notice) throws FinalizationException {
        jobStatusService.logInfo(job, "Create patron deliverable for " + masterFile.getFilename());
        final IntendedUse use = unit.getIntendedUse();
        final String desiredRes = use.getDeliverableResolution() == null ? "" : use.getDeliverableResolution();
        final int actualRes = techMeta == null ? 0 : techMeta.getResolution();
        if ("300".equals(desiredRes) && actualRes == 0) {
            throw new FinalizationException("actual_resolution is required when desired_resolution is specified");
        }

        final String format = use.getDeliverableFormat() == null ? "" : use.getDeliverableFormat().toLowerCase(Locale.ROOT);
        final String suffix;
        boolean addLegalNotice = false;
        switch (format) {
            case "jpeg" -> {
                suffix = ".jpg";
                addLegalNotice = !(unit.getMetadata().isPersonalItem() || unit.isRemoveWatermark()
                        || UNWATERMARKED_USES.contains(use.getId()));
                jobStatusService.logInfo(job, addLegalNotice
                        ? "Patron deliverable is a jpg file and will have a watermark"
                        : "Patron deliverable is a jpg file and will NOT have a watermark");
            }
            case "tiff" -> {
                suffix = ".tif";
                jobStatusService.logInfo(job, "Patron deliverable is a tif file and will NOT have a watermark");
            }
            default -> throw new FinalizationException("unknown deliverable format " + use.getDeliverableFormat());
        }

        final Path dest = assembleDir.resolve(FilenameUtils.getBaseName(masterFile.getFilename()) + suffix);
        if (Files.exists(dest)) {
            jobStatusService.logInfo(job, "Deliverable already exists at " + dest);
            return;
        }

        try {
            if (".tif".equals(suffix) && isFullResolution(desiredRes)) {
                Files.copy(source, dest, StandardCopyOption.REPLACE_EXISTING);
                return;
            }

            final List<String> command = new ArrayList<>();
            command.add("magick");
            command.add(source + "[0]");
            if (addLegalNotice) {
                jobStatusService.logInfo(job, "Adding legal notice");
                final int width = techMeta == null ? 0 : techMeta.getWidth();
                final double pointSize = Math.max(22.0, width * 0.015);
                command.addAll(List.of("-bordercolor", "lightgray", "-border", "0x10",
                                       "-pointsize", String.format(Locale.ROOT, "%.2f", pointSize),
                                       "-size", width + "x",
                                       "-background", "lightgray", "-gravity", "center",
                                       "caption:" + legalNotice(unit, notice),
                                       "-gravity", "Center", "-append",
                                       "-bordercolor", "lightgray", "-border", "30x20"));
            }
            final int resample = parseResolution(desiredRes);
            if (resample > 0) {
                command.addAll(List.of("-resample", Integer.toString(resample)));
            }
            command.add(dest.toString());
            processExecutor.run(command, masterFile.getFilename(), "magick");
        } catch (final IOException | ProcessExecutionException e) {
            throw new FinalizationException("Create patron deliverable failed: " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FinalizationException("Interrupted while creating patron deliverable for " + masterFile.getFilename(), e);
        }
        jobStatusService.logInfo(job, "Patron deliverable created at " + dest);
    }

    /**
     * Builds the unit's deliverables unless they are already marked ready, then stamps the ready date.
     */
    public void generateUnitDeliverables(final JobStatus job, final Unit unit, final List<StagedImage> images)
            throws FinalizationException {
        if (unit.getDatePatronDeliverablesReady() != null) {
            jobStatusService.logInfo(job, "Patron deliverables already generated");
            return;
        }
        if (unit.getIntendedUse().isPdfDeliverable()) {
            createPatronPdf(job, unit, images);
        } else {
            zipPatronDeliverables(job, unit);
        }
        final LocalDateTime now = LocalDateTime.now();
        unitRepository.markPatronDeliverablesReady(unit.getId(), now);
        unit.setDatePatronDeliverablesReady(now);
        jobStatusService.logInfo(job, "All patron deliverables created");
    }

    void createPatronPdf(final JobStatus job, final Unit unit, final List<StagedImage> images) throws FinalizationException {
        jobStatusService.logInfo(job, "Unit requires the creation of PDF patron deliverables.");
        try {
            final Path assembleDir = workDirectoryService.ensureAssembleDir(unit.getId());
            final Path pdf = assembleDir.resolve(unit.getId() + ".pdf");
            Files.deleteIfExists(pdf);

            final List<String> command = new ArrayList<>();
            command.add("magick");
            for (final StagedImage image : images) {
                command.add(image.path() + "[0]");
            }
            command.addAll(List.of("-compress", "jpeg", "-quality", "75", pdf.toString()));
            processExecutor.run(command, "unit " + unit.getId(), "magick");
            jobStatusService.logInfo(job, "PDF of " + images.size() + " pages created at " + pdf);

            final Path deliveryDir = Files.createDirectories(workDirectoryService.deliveryDir(unit.getOrder().getId()));
            final Path zip = deliveryDir.resolve(unit.getId() + ".zip");
            jobStatusService.logInfo(job, "Zip PDF to " + zip);
            Files.deleteIfExists(zip);
            try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(zip))) {
                addToZip(out, pdf);
            }
            jobStatusService.logInfo(job, "Zip deliverable of PDF created.");
        } catch (final IOException | ProcessExecutionException e) {
            throw new FinalizationException("Unable to create patron PDF: " + e.getMessage(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FinalizationException("Interrupted while creating patron PDF", e);
        }
    }

    /**
     * Zips the per-image renditions into {@code <unit>_<n>.zip}, starting a new archive once one passes 2 GiB.
     */
    void zipPatronDeliverables(final JobStatus job, final Unit unit) throws FinalizationException {
        jobStatusService.logInfo(job, "Zipping deliverables for unit " + unit.getId());
        final Path assembleDir = workDirectoryService.assembleDir(unit.getId());
        final List<MasterFile> masterFiles = masterFileRepository.findByUnitIdOrderByFilenameAsc(unit.getId());
        final boolean jpeg = "jpeg".equalsIgnoreCase(unit.getIntendedUse().getDeliverableFormat());

        try {
            final Path deliveryDir = Files.createDirectories(workDirectoryService.deliveryDir(unit.getOrder().getId()));
            if (unit.isOcrMasterFiles()) {
                writeOcrText(job, unit, assembleDir, masterFiles);
            }

            int zipNum = 0;
            long zipSize = 0;
            ZipOutputStream out = null;
            try {
                for (final MasterFile masterFile : masterFiles) {
                    if (out == null || zipSize > MAX_ZIP_BYTES) {
                        if (out != null) {
                            out.close();
                            jobStatusService.logInfo(job, "Zip 2GB max filesize exceeded; creating zip #" + (zipNum + 1));
                        }
                        zipNum++;
                        zipSize = 0;
                        final Path zip = deliveryDir.resolve(unit.getId() + "_" + zipNum + ".zip");
                        jobStatusService.logInfo(job, "Create " + zip + "...");
                        Files.deleteIfExists(zip);
                        out = new ZipOutputStream(Files.newOutputStream(zip));
                    }
                    final String deliverable = jpeg
                            ? FilenameUtils.getBaseName(masterFile.getFilename()) + ".jpg"
                            : masterFile.getFilename();
                    zipSize += addToZip(out, assembleDir.resolve(deliverable));
                }
                if (out != null && unit.isOcrMasterFiles()) {
                    final Path ocrText = assembleDir.resolve(unit.getId() + ".txt");
                    if (Files.exists(ocrText)) {
                        addToZip(out, ocrText);
                    }
                }
            } finally {
                if (out != null) {
                    out.close();
                }
            }
        } catch (final IOException e) {
            throw new FinalizationException("Unable to create patron ZIP: " + e.getMessage(), e);
        }
    }

    private void writeOcrText(final JobStatus job, final Unit unit, final Path assembleDir,
                              final List<MasterFile> masterFiles) {
        final Path ocrFile = assembleDir.resolve(unit.getId() + ".txt");
        jobStatusService.logInfo(job, "OCR was requested for this unit; generate text file with OCR results here: " + ocrFile);
        try {
            Files.createDirectories(assembleDir);
            try (BufferedWriter writer = Files.newBufferedWriter(ocrFile, StandardCharsets.UTF_8)) {
                for (final MasterFile masterFile : masterFiles) {
                    writer.write(masterFile.getFilename());
                    writer.newLine();
                    writer.write(masterFile.getTranscriptionText() == null ? "" : masterFile.getTranscriptionText());
                    writer.newLine();
                }
            }
        } catch (final IOException e) {
            log.error("Unable to write OCR text {}", ocrFile, e);
            jobStatusService.logError(job, "Unable to open OCR file " + ocrFile + ": " + e.getMessage());
        }
    }

    /**
     * @return the number of bytes added.
     */
    private static long addToZip(final ZipOutputStream out, final Path file) throws IOException {
        out.putNextEntry(new ZipEntry(file.getFileName().toString()));
        final long size = Files.copy(file, (OutputStream) out);
        out.closeEntry();
        return size;
    }

    static String legalNotice(final Unit unit, final NoticeContext context) {
        final StringBuilder notice = new StringBuilder();
        final String title = unit.getMetadata().getTitle() == null ? "" : unit.getMetadata().getTitle();
        notice.append("Title: ")
              .append(title.length() < MAX_NOTICE_TITLE ? title : title.substring(0, MAX_NOTICE_TITLE))
              .append('\n');
        if (StringUtils.hasText(context.callNumber())) {
            notice.append("Call Number: ").append(context.callNumber()).append('\n');
        }
        if (StringUtils.hasText(context.location())) {
            notice.append("Location: ").append(context.location()).append('\n');
        }
        final long useId = unit.getIntendedUse().getId();
        if (PRIVATE_STUDY_USES.contains(useId)) {
            notice.append(PRIVATE_STUDY_NOTICE);
        } else if (useId == CLASSROOM_USE) {
            notice.append(CLASSROOM_NOTICE);
        }
        return notice.toString();
    }

    private static boolean isFullResolution(final String desiredRes) {
        return desiredRes.isEmpty() || "Highest Possible".equals(desiredRes);
    }

    private static int parseResolution(final String desiredRes) {
        try {
            return Integer.parseInt(desiredRes);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
