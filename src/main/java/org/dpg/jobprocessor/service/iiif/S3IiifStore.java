package org.dpg.jobprocessor.service.iiif;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.processexec.ProcessExecutor;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.exception.ProcessExecutionException;
import org.dpg.jobprocessor.service.storage.S3ObjectStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;

/**
 * {@link IiifStore} on S3. TIFF sources are compressed to JP2 with ImageMagick in the staging
 * directory, then uploaded; JP2 sources are uploaded as they are.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3IiifStore implements IiifStore {

    private final S3ObjectStore objectStore;
    private final ProcessExecutor processExecutor;
    private final JobProcessingConfig config;

    @Override
    public boolean exists(final String pid) {
        return objectStore.existsUnderPrefix(config.getIiif().getBucket(), IiifKey.forPid(pid).prefix());
    }

    @Override
    public boolean publish(final Path source, final String pid, final String imageFormat, final boolean overwrite)
            throws IOException, InterruptedException, ProcessExecutionException {
        final String format = imageFormat == null ? "" : imageFormat.toLowerCase(Locale.ROOT);
        if (!"tiff".equals(format) && !"jp2".equals(format)) {
            throw new IOException("Unsupported image format for " + pid + ": " + imageFormat);
        }

        final IiifKey key = IiifKey.forPid(pid);
        if (exists(pid)) {
            if (!overwrite) {
                log.debug("{} already has a JP2 at {}; keeping it", pid, key.s3Key());
                return false;
            }
            log.info("Existing JP2 for {} will be overwritten", pid);
        }

        final Path stagingDir = Paths.get(config.getIiif().getStagingDir());
        Files.createDirectories(stagingDir);
        final Path staged = stagingDir.resolve(key.fileName());
        try {
            if ("jp2".equals(format)) {
                Files.copy(source, staged, StandardCopyOption.REPLACE_EXISTING);
            } else {
                final long start = System.currentTimeMillis();
                // [0] takes the first page only; some tifs carry a thumbnail page
                processExecutor.run(List.of("magick", source + "[0]",
                                            "-define", "jp2:rate=50",
                                            "-define", "jp2:progression-order=RPCL",
                                            "-define", "jp2:number-resolutions=7",
                                            staged.toString()), pid, "magick");
                log.info("Compressed {} to JP2 in {} ms", source.getFileName(), System.currentTimeMillis() - start);
            }
            objectStore.upload(config.getIiif().getBucket(), key.s3Key(), staged);
            return true;
        } finally {
            Files.deleteIfExists(staged);
        }
    }

    @Override
    public void remove(final String pid) {
        objectStore.delete(config.getIiif().getBucket(), IiifKey.forPid(pid).s3Key());
    }
}
