package org.dpg.jobprocessor.service.project;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.ImageTechMetaRepository;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.service.archive.ArchiveStore;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Last check of a finalized unit before it is marked done: archived when it has to be, every image
 * described, and its deliverables dated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectCompletionValidator {

    private final MasterFileRepository masterFileRepository;
    private final ImageTechMetaRepository imageTechMetaRepository;
    private final ArchiveStore archiveStore;
    private final JobStatusService jobStatusService;

    public void validate(final JobStatus job, final Unit unit) throws FinalizationException {
        jobStatusService.logInfo(job, "Validate unit " + unit.getId() + " completion");
        final List<MasterFile> masterFiles = masterFileRepository.findByUnitIdOrderByFilenameAsc(unit.getId());

        if (!unit.isThrowAway()) {
            if (unit.getDateArchived() == null) {
                throw new FinalizationException("Unit was not archived");
            }
            final long tifCount = countArchivedTifs(unit.getId());
            if (tifCount == 0) {
                throw new FinalizationException("No tif files found in archive");
            }
            if (tifCount != masterFiles.size()) {
                throw new FinalizationException(String.format("MasterFile / tif count mismatch. %d tif files vs %d MasterFiles",
                                                              tifCount, masterFiles.size()));
            }
        }

        final Set<Long> described = imageTechMetaRepository
                .findByMasterFileIdIn(masterFiles.stream().map(MasterFile::getId).collect(Collectors.toList()))
                .stream().map(techMeta -> techMeta.getMasterFileId()).collect(Collectors.toSet());
        for (final MasterFile masterFile : masterFiles) {
            if (!StringUtils.hasText(masterFile.getTitle())) {
                throw new FinalizationException(String.format("Masterfile %s missing desc metadata", masterFile.getFilename()));
            }
            if (!described.contains(masterFile.getId())) {
                throw new FinalizationException(String.format("Masterfile %s missing desc tech metadata", masterFile.getFilename()));
            }
        }

        if (unit.isDigitalCollectionBuilding()) {
            if (unit.isIncludeInDl() && unit.getDateDlDeliverablesReady() == null) {
                throw new FinalizationException("DL deliverables ready date not set");
            }
        } else if (unit.getDatePatronDeliverablesReady() == null) {
            throw new FinalizationException("Patron deliverables ready date not set");
        }
    }

    private long countArchivedTifs(final long unitId) throws FinalizationException {
        final Path dir = archiveStore.unitDirectory(unitId);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                        .filter(file -> "tif".equals(FilenameUtils.getExtension(file.getFileName().toString())))
                        .count();
        } catch (final IOException e) {
            throw new FinalizationException("Unable to read archive " + dir + ": " + e.getMessage(), e);
        }
    }
}
