package org.dpg.jobprocessor.service.techmeta;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.json.JsonParser;
import org.dpg.jobprocessor.common.processexec.ProcessExecutor;
import org.dpg.jobprocessor.exception.ExtractionException;
import org.dpg.jobprocessor.exception.ProcessExecutionException;
import org.dpg.jobprocessor.exception.json.JsonParsingException;
import org.dpg.jobprocessor.model.ImageTechMeta;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * {@link TechMetadataExtractor} that runs {@code exiftool -json} and maps its first record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExifToolMetadataExtractor implements TechMetadataExtractor {

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd");

    private final ProcessExecutor processExecutor;
    private final JsonParser jsonParser;

    @Override
    public ImageTechMeta extract(final Path imagePath, final long masterFileId) throws ExtractionException {
        final JsonNode md = readExif(imagePath, List.of("exiftool", "-json", imagePath.toString()));

        final ImageTechMeta techMeta = ImageTechMeta.builder()
                                                    .masterFileId(masterFileId)
                                                    .imageFormat(text(md, "FileType"))
                                                    .width(md.path("ImageWidth").asInt(0))
                                                    .height(md.path("ImageHeight").asInt(0))
                                                    .resolution(md.path("XResolution").asInt(0))
                                                    .depth(depth(md))
                                                    .compression(text(md, "Compression"))
                                                    .colorProfile(text(md, "ProfileDescription"))
                                                    .colorSpace(colorSpace(md))
                                                    .equipment(text(md, "Make"))
                                                    .software(text(md, "Software"))
                                                    .model(text(md, "Model"))
                                                    .exifVersion(text(md, "ExifVersion"))
                                                    .captureDate(captureDate(text(md, "DateCreated")))
                                                    .iso(md.path("ISO").asInt(0))
                                                    .exposureBias(text(md, "ExposureCompensation"))
                                                    .exposureTime(text(md, "ExposureTime"))
                                                    .aperture(text(md, "ApertureValue"))
                                                    .focalLength(focalLength(text(md, "FocalLength")))
                                                    .build();

        if (techMeta.getWidth() == 0 || techMeta.getHeight() == 0) {
            throw new ExtractionException("Image " + imagePath.getFileName() + " has no dimensions");
        }
        if (techMeta.getColorSpace() != null && techMeta.getColorSpace().toUpperCase(Locale.ROOT).contains("CMYK")) {
            throw new ExtractionException("Image " + imagePath.getFileName() + " uses unsupported color space "
                                                  + techMeta.getColorSpace());
        }
        log.debug("Tech metadata of {}: {}", imagePath.getFileName(), techMeta);
        return techMeta;
    }

    @Override
    public DescriptiveMetadata extractDescriptive(final Path imagePath) throws ExtractionException {
        final JsonNode md = readExif(imagePath, List.of("exiftool", "-json", "-iptc:headline",
                                                        "-iptc:caption-abstract", imagePath.toString()));
        final String title = text(md, "Headline");
        if (title == null) {
            throw new ExtractionException("missing required Headline in tif metadata for " + imagePath);
        }
        return new DescriptiveMetadata(title, text(md, "Caption-Abstract"));
    }

    private JsonNode readExif(final Path imagePath, final List<String> command) throws ExtractionException {
        final ProcessExecutor.ProcessResult result;
        try {
            result = processExecutor.run(command, imagePath.getFileName().toString(), "exiftool");
        } catch (IOException | ProcessExecutionException e) {
            throw new ExtractionException("Unable to read metadata of " + imagePath + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while reading metadata of " + imagePath, e);
        }

        final JsonNode records;
        try {
            records = jsonParser.parseObject(result.stdout(), JsonNode.class);
        } catch (JsonParsingException e) {
            throw new ExtractionException("exiftool returned unreadable output for " + imagePath, e);
        }
        if (records == null || !records.isArray() || records.isEmpty()) {
            throw new ExtractionException("exiftool returned no metadata for " + imagePath);
        }
        return records.get(0);
    }

    private static String text(final JsonNode md, final String field) {
        final JsonNode value = md.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * "Uncalibrated" is refined from ColorMode or ColorSpaceData when exiftool reports them.
     */
    private static String colorSpace(final JsonNode md) {
        final String colorSpace = text(md, "ColorSpace");
        if (colorSpace == null) {
            return text(md, "ColorSpaceData");
        }
        if ("Uncalibrated".equals(colorSpace)) {
            if (text(md, "ColorMode") != null) {
                return text(md, "ColorMode");
            }
            if (text(md, "ColorSpaceData") != null) {
                return text(md, "ColorSpaceData");
            }
        }
        return colorSpace;
    }

    /**
     * Bits per pixel. BitsPerSample is either a number or a per-channel list such as "8 8 8".
     */
    static int depth(final JsonNode md) {
        final JsonNode samples = md.get("SamplesPerPixel");
        final JsonNode bits = md.get("BitsPerSample");
        if (samples == null || !samples.isNumber() || bits == null) {
            return 0;
        }
        double bitsPerSample;
        if (bits.isNumber()) {
            bitsPerSample = bits.asDouble();
        } else {
            try {
                bitsPerSample = Double.parseDouble(bits.asText().trim().split("\\s+")[0]);
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return (int) (bitsPerSample * samples.asDouble());
    }

    /**
     * "120.0 mm" becomes 120.0.
     */
    static double focalLength(final String raw) {
        if (raw == null || raw.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(raw.trim().split(" ")[0]);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static LocalDateTime captureDate(final String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(raw.trim(), EXIF_DATE).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable capture date '{}'", raw);
            return null;
        }
    }
}
