package org.dpg.jobprocessor.service.archive;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * {@link ArchiveStore} on the mounted archive volume: {@code <archiveDir>/<unitId %09d>/<filename>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileSystemArchiveStore implements ArchiveStore {

    private final JobProcessingConfig config;

    @Override
    public String put(final Path source, final long unitId, final String filename) throws IOException {
        final Path unitDir = unitDirectory(unitId);
        Files.createDirectories(unitDir);
        final Path target = unitDir.resolve(filename);
        FileUtils.copyFile(source.toFile(), target.toFile());
        final String md5 = md5(target);
        log.info("Archived {} to {} (md5 {})", filename, target, md5);
        return md5;
    }

    @Override
    public void remove(final long unitId, final String filename) throws IOException {
        final Path target = unitDirectory(unitId).resolve(filename);
        if (!Files.deleteIfExists(target)) {
            throw new NoSuchFileException(target.toString(), null, "no archived file to remove");
        }
        log.info("Removed archived file {}", target);
    }

    @Override
    public void rename(final long unitId, final String oldName, final String newName, final String expectedMd5)
            throws IOException {
        final Path unitDir = unitDirectory(unitId);
        final Path renamed = Files.move(unitDir.resolve(oldName), unitDir.resolve(newName));
        final String md5 = md5(renamed);
        if (!md5.equals(expectedMd5)) {
            throw new IOException("Archived file " + renamed + " has checksum " + md5 + ", expected " + expectedMd5);
        }
        log.info("Renamed archived file {} to {}", oldName, newName);
    }

    @Override
    public Path unitDirectory(final long unitId) {
        return Paths.get(config.getArchiveDir(), String.format("%09d", unitId));
    }

    public static String md5(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return DigestUtils.md5Hex(in);
        }
    }
}
