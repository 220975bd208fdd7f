package org.dpg.jobprocessor.service.finalization;

import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.exception.FinalizationException;
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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FilesystemQaServiceTest {

    private static final long UNIT_ID = 42L;
    private static final int MIN_SIZE = 16;

    @Mock
    private JobStatusService jobStatusService;

    @TempDir
    Path srcDir;

    private FilesystemQaService service;
    private final JobStatus job = new JobStatus();

    @BeforeEach
    void setUp() {
        final JobProcessingConfig config = new JobProcessingConfig();
        config.getFinalization().setMinImageSizeBytes(MIN_SIZE);
        service = new FilesystemQaService(jobStatusService, config);
        job.setId(5L);
    }

    @Test
    void sequentialImagesPass() throws Exception {
        // given
        image("000000042_0001.tif", MIN_SIZE);
        image("000000042_0002.tif", MIN_SIZE + 10);
        image("000000042_0002.txt", 3);
        image(".DS_Store", 1);

        // when
        service.qaFilesystem(job, UNIT_ID, srcDir);

        // then
        verify(jobStatusService).logInfo(job, "Filesystem QA tests passed");
    }

    @Test
    void gapInPagesFails() throws Exception {
        // given
        image("000000042_0001.tif", MIN_SIZE);
        image("000000042_0003.tif", MIN_SIZE);

        // when / then
        assertThatThrownBy(() -> service.qaFilesystem(job, UNIT_ID, srcDir))
                .isInstanceOf(FinalizationException.class)
                .hasMessage(FilesystemQaService.QA_FAILED);
        verify(jobStatusService).logError(job, "Out of sequence .tif file found: 000000042_0003.tif");
    }

    @Test
    void wrongNameSmallFileAndStrayFileAreAllReported() throws Exception {
        // given
        image("000000042_0001.tif", MIN_SIZE);
        final Path misnamed = image("000000043_0002.tif", MIN_SIZE);
        final Path small = image("000000042_0002.tif", MIN_SIZE - 1);
        final Path stray = image("notes.doc", 4);

        // when / then
        assertThatThrownBy(() -> service.qaFilesystem(job, UNIT_ID, srcDir)).isInstanceOf(FinalizationException.class);
        verify(jobStatusService).logError(job, "Incorrectly named .tif file found: " + misnamed);
        verify(jobStatusService).logError(job, small + " filesize is less than " + MIN_SIZE
                + " and is very likely an incorrect file.");
        verify(jobStatusService).logError(job, "Unexpected file found: " + stray);
    }

    @Test
    void emptyDirectoryFails() {
        assertThatThrownBy(() -> service.qaFilesystem(job, UNIT_ID, srcDir)).isInstanceOf(FinalizationException.class);
        verify(jobStatusService).logError(job, "No .tif files found in " + srcDir);
    }

    @Test
    void listImagesIsSortedAndSkipsText() throws Exception {
        // given
        image("000000042_0002.tif", MIN_SIZE);
        image("000000042_0001.tif", MIN_SIZE);
        image("000000042_0001.txt", 3);

        // when
        final List<StagedImage> images = service.listImages(srcDir, UNIT_ID);

        // then
        assertThat(images).extracting(StagedImage::filename)
                          .containsExactly("000000042_0001.tif", "000000042_0002.tif");
        assertThat(images.get(0).transcriptionPath()).isEqualTo(srcDir.resolve("000000042_0001.txt"));
    }

    @Test
    void pageNumberIsParsedFromSuffix() {
        assertThat(FilesystemQaService.pageNumber("000000042_0007.tif")).isEqualTo(7);
        assertThat(FilesystemQaService.pageNumber("000000042_abcd.tif")).isZero();
    }

    private Path image(final String name, final int size) throws IOException {
        return Files.write(srcDir.resolve(name), new byte[size]);
    }
}
