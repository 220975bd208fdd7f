package org.dpg.jobprocessor.service.finalization;

import java.nio.file.Path;

/**
 * A master image in the unit's staging directory that passed filesystem QA.
 */
public record StagedImage(Path path, String filename, long size) {

    /**
     * The transcription file staged next to the image, {@code 000000042_0001.txt} for
     * {@code 000000042_0001.tif}.
     */
    public Path transcriptionPath() {
        final String base = filename.substring(0, filename.lastIndexOf('.'));
        return path.resolveSibling(base + ".txt");
    }
}
