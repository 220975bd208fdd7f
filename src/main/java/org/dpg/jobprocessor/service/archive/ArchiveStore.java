package org.dpg.jobprocessor.service.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Long-term store of original master images, one directory per unit.
 */
public interface ArchiveStore {

    /**
     * Copies a file into the unit's archive directory.
     *
     * @return MD5 checksum of the archived copy, as lower-case hex.
     */
    String put(Path source, long unitId, String filename) throws IOException;

    void remove(long unitId, String filename) throws IOException;

    /**
     * Renames an archived file and verifies its checksum afterwards.
     *
     * @throws IOException if the move fails or the renamed file does not match {@code expectedMd5}.
     */
    void rename(long unitId, String oldName, String newName, String expectedMd5) throws IOException;

    Path unitDirectory(long unitId);
}
