package org.dpg.jobprocessor.service.finalization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Layout of the processing volume used by finalization:
 * <pre>
 * finalization/&lt;unit&gt;        staged master images
 * finalization/tmp/&lt;unit&gt;    patron deliverables being assembled
 * scan/&lt;unit&gt;                scans still in capture
 * ready_to_delete/...          finished directories awaiting deletion
 * </pre>
 * Unit directories are named by the zero-padded nine digit unit ID.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkDirectoryService {

    private final JobProcessingConfig config;
    private final JobStatusService jobStatusService;

    public static String unitDirName(final long unitId) {
        return String.format("%09d", unitId);
    }

    public Path finalizationDir(final long unitId) {
        return Paths.get(config.getProcessingDir(), "finalization", unitDirName(unitId));
    }

    public Path assembleDir(final long unitId) {
        return Paths.get(config.getProcessingDir(), "finalization", "tmp", unitDirName(unitId));
    }

    public Path deliveryDir(final long orderId) {
        return Paths.get(config.getDeliveryDir(), "order_" + orderId);
    }

    /**
     * Creates (if needed) and returns the directory the unit's patron deliverables are assembled in.
     */
    public Path ensureAssembleDir(final long unitId) throws IOException {
        return Files.createDirectories(assembleDir(unitId));
    }

    /**
     * Removes the assemble directory and moves the unit's staging and scan directories to
     * {@code ready_to_delete}. Failures are logged as job errors and do not stop the cleanup.
     */
    public void cleanup(final JobStatus job, final long unitId) {
        final String unitDir = unitDirName(unitId);
        jobStatusService.logInfo(job, "Cleaning up unit " + unitDir + " directories");
        FileUtils.deleteQuietly(assembleDir(unitId).toFile());

        final Path readyToDelete = Paths.get(config.getProcessingDir(), "ready_to_delete");
        moveToReadyToDelete(job, finalizationDir(unitId), readyToDelete.resolve(unitDir),
                            "Unable to move working file to ");

        final Path scanDir = Paths.get(config.getProcessingDir(), "scan", unitDir);
        if (Files.exists(scanDir)) {
            jobStatusService.logInfo(job, "Cleaning up unit " + unitDir + " scan directories");
            moveToReadyToDelete(job, scanDir, readyToDelete.resolve("from_scan").resolve(unitDir),
                                "Unable to move scan directory to ");
        }
    }

    private void moveToReadyToDelete(final JobStatus job, final Path source, final Path target, final String errorPrefix) {
        jobStatusService.logInfo(job, "Moving " + source + " to " + target);
        try {
            if (Files.exists(target)) {
                jobStatusService.logInfo(job, target + " already exists; cleaning it up");
                FileUtils.deleteDirectory(target.toFile());
            }
            Files.createDirectories(target.getParent());
            FileUtils.moveDirectory(source.toFile(), target.toFile());
        } catch (final IOException e) {
            log.error("Moving {} to {} failed", source, target, e);
            jobStatusService.logError(job, errorPrefix + target + ": " + e.getMessage());
        }
    }
}
