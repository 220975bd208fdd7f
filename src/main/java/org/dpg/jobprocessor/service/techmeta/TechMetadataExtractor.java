package org.dpg.jobprocessor.service.techmeta;

import org.dpg.jobprocessor.exception.ExtractionException;
import org.dpg.jobprocessor.model.ImageTechMeta;

import java.nio.file.Path;

/**
 * Reads the embedded metadata of a master image.
 */
public interface TechMetadataExtractor {

    /**
     * Reads the technical metadata of an image. The returned entity is not saved.
     *
     * @throws ExtractionException if the image cannot be read, has no dimensions or uses an unsupported
     *                             color space.
     */
    ImageTechMeta extract(Path imagePath, long masterFileId) throws ExtractionException;

    /**
     * @throws ExtractionException if the image cannot be read or carries no headline.
     */
    DescriptiveMetadata extractDescriptive(Path imagePath) throws ExtractionException;
}
