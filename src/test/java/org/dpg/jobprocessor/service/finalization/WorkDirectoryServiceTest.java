package org.dpg.jobprocessor.service.finalization;

import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WorkDirectoryServiceTest {

    @Mock
    private JobStatusService jobStatusService;

    @TempDir
    Path processingDir;

    private WorkDirectoryService service;
    private final JobStatus job = new JobStatus();

    @BeforeEach
    void setUp() {
        final JobProcessingConfig config = new JobProcessingConfig();
        config.setProcessingDir(processingDir.toString());
        config.setDeliveryDir("/digiserv-delivery");
        service = new WorkDirectoryService(config, jobStatusService);
    }

    @Test
    void unitDirectoriesUseNineDigitIds() {
        // when / then
        assertThat(WorkDirectoryService.unitDirName(42L)).isEqualTo("000000042");
        assertThat(service.finalizationDir(42L)).isEqualTo(processingDir.resolve("finalization/000000042"));
        assertThat(service.assembleDir(42L)).isEqualTo(processingDir.resolve("finalization/tmp/000000042"));
        assertThat(service.deliveryDir(9L)).isEqualTo(Path.of("/digiserv-delivery", "order_9"));
    }

    @Test
    void cleanupMovesStagingAndScanDirectoriesToReadyToDelete() throws IOException {
        // given
        final Path staged = Files.createDirectories(processingDir.resolve("finalization/000000042"));
        Files.writeString(staged.resolve("000000042_0001.tif"), "image");
        final Path scan = Files.createDirectories(processingDir.resolve("scan/000000042"));
        Files.writeString(scan.resolve("000000042_0001.tif"), "raw scan");
        final Path assemble = service.ensureAssembleDir(42L);
        Files.writeString(assemble.resolve("000000042_0001.jpg"), "patron copy");

        // when
        service.cleanup(job, 42L);

        // then
        assertThat(assemble).doesNotExist();
        assertThat(staged).doesNotExist();
        assertThat(scan).doesNotExist();
        assertThat(processingDir.resolve("ready_to_delete/000000042/000000042_0001.tif")).hasContent("image");
        assertThat(processingDir.resolve("ready_to_delete/from_scan/000000042/000000042_0001.tif"))
                .hasContent("raw scan");
        verify(jobStatusService, never()).logError(eq(job), anyString());
    }

    @Test
    void cleanupReplacesLeftoversOfEarlierRun() throws IOException {
        // given
        final Path staged = Files.createDirectories(processingDir.resolve("finalization/000000042"));
        Files.writeString(staged.resolve("000000042_0001.tif"), "second run");
        final Path leftover = Files.createDirectories(processingDir.resolve("ready_to_delete/000000042"));
        Files.writeString(leftover.resolve("stale.tif"), "first run");

        // when
        service.cleanup(job, 42L);

        // then
        assertThat(leftover.resolve("stale.tif")).doesNotExist();
        assertThat(leftover.resolve("000000042_0001.tif")).hasContent("second run");
    }

    @Test
    void missingStagingDirectoryIsLoggedAsJobError() {
        // when
        service.cleanup(job, 42L);

        // then
        verify(jobStatusService).logError(eq(job), startsWith(
                "Unable to move working file to " + processingDir.resolve("ready_to_delete/000000042")));
    }
}
