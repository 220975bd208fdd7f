package org.dpg.jobprocessor.service.finalization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks the staged images of a unit before anything is imported:
 * <ol>
 *     <li>there is at least one .tif file;</li>
 *     <li>every .tif is named {@code <unit %09d>_<page>.tif};</li>
 *     <li>page numbers run from 1 without gaps;</li>
 *     <li>no image is smaller than the configured minimum, which usually means a truncated capture;</li>
 *     <li>nothing but .tif and .txt files is present.</li>
 * </ol>
 * Every violation is logged as a job error before the check fails as a whole.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilesystemQaService {

    static final String QA_FAILED = "Unit has failed the Filesystem QA";
    private static final String MAC_FOLDER_FILE = ".DS_Store";

    private final JobStatusService jobStatusService;
    private final JobProcessingConfig config;

    public void qaFilesystem(final JobStatus job, final long unitId, final Path srcDir) throws FinalizationException {
        jobStatusService.logInfo(job, "QA filesystem");
        final long minSize = config.getFinalization().getMinImageSizeBytes();
        final Pattern namePattern = masterFileNamePattern(unitId);

        boolean hasFailures = false;
        final List<String> tifNames = new ArrayList<>();
        final List<Path> files;
        try {
            files = regularFiles(srcDir);
        } catch (final IOException e) {
            throw new FinalizationException("Unable to read " + srcDir + ": " + e.getMessage(), e);
        }
        for (final Path file : files) {
            final String name = file.getFileName().toString();
            if (MAC_FOLDER_FILE.equals(name)) {
                continue;
            }
            final String ext = FilenameUtils.getExtension(name);
            if ("tif".equals(ext)) {
                if (namePattern.matcher(name).matches()) {
                    tifNames.add(name);
                } else {
                    hasFailures = true;
                    jobStatusService.logError(job, "Incorrectly named .tif file found: " + file);
                }
                if (size(file) < minSize) {
                    hasFailures = true;
                    jobStatusService.logError(job, file + " filesize is less than " + minSize
                            + " and is very likely an incorrect file.");
                }
            } else if (!"txt".equals(ext)) {
                hasFailures = true;
                jobStatusService.logError(job, "Unexpected file found: " + file);
            }
        }

        if (tifNames.isEmpty()) {
            hasFailures = true;
            jobStatusService.logError(job, "No .tif files found in " + srcDir);
        }

        tifNames.sort(Comparator.naturalOrder());
        int expectedPage = 1;
        for (final String name : tifNames) {
            if (pageNumber(name) != expectedPage) {
                hasFailures = true;
                jobStatusService.logError(job, "Out of sequence .tif file found: " + name);
            }
            expectedPage++;
        }

        if (hasFailures) {
            throw new FinalizationException(QA_FAILED);
        }
        jobStatusService.logInfo(job, "Filesystem QA tests passed");
    }

    /**
     * Lists the unit's master images under a directory, sorted by name.
     *
     * @throws IOException if the directory cannot be read or holds a .tif that is not a master image of the unit.
     */
    public List<StagedImage> listImages(final Path dir, final long unitId) throws IOException {
        final Pattern namePattern = masterFileNamePattern(unitId);
        final List<StagedImage> images = new ArrayList<>();
        for (final Path file : regularFiles(dir)) {
            final String name = file.getFileName().toString();
            if (!"tif".equals(FilenameUtils.getExtension(name))) {
                continue;
            }
            if (!namePattern.matcher(name).matches()) {
                throw new IOException("invalid file in " + dir + ": " + name);
            }
            images.add(new StagedImage(file, name, Files.size(file)));
        }
        images.sort(Comparator.comparing(StagedImage::filename));
        return images;
    }

    static Pattern masterFileNamePattern(final long unitId) {
        return Pattern.compile("^" + WorkDirectoryService.unitDirName(unitId) + "_\\w{4,}\\.tif$");
    }

    /**
     * Page number of {@code 000000042_0007.tif} is 7; anything unparseable is page 0.
     */
    static int pageNumber(final String filename) {
        final String base = FilenameUtils.getBaseName(filename);
        final int underscore = base.indexOf('_');
        try {
            return Integer.parseInt(base.substring(underscore + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<Path> regularFiles(final Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    private static long size(final Path file) throws FinalizationException {
        try {
            return Files.size(file);
        } catch (final IOException e) {
            throw new FinalizationException("Unable to read size of " + file + ": " + e.getMessage(), e);
        }
    }
}
