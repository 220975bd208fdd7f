package org.dpg.jobprocessor.service.iiif;

import org.dpg.jobprocessor.exception.ProcessExecutionException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Store of the JP2 derivatives served by the IIIF image server, addressed by master file PID.
 */
public interface IiifStore {

    boolean exists(String pid);

    /**
     * Converts the source image to JP2 if needed and stores it under the PID.
     *
     * @param imageFormat format of the source as reported by the metadata extractor, {@code tiff} or {@code jp2}.
     * @param overwrite   replace an existing derivative; when false an existing one is kept.
     * @return true if a derivative was written, false if an existing one was kept.
     */
    boolean publish(Path source, String pid, String imageFormat, boolean overwrite)
            throws IOException, InterruptedException, ProcessExecutionException;

    void remove(String pid);
}
