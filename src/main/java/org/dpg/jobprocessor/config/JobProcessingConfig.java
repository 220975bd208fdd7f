package org.dpg.jobprocessor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app.processing" prefix. Holds the filesystem roots used
 * by finalization and the tunables of each background workflow.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class JobProcessingConfig {

    private String processingDir;
    private String archiveDir;
    private String deliveryDir;
    private String bagDir;

    /**
     * Public base URL of this service; OCR callbacks are addressed to it.
     */
    private String serviceUrl;

    private long processTimeoutMinutes = 30;
    private RetryConfig retry = new RetryConfig();
    private Finalization finalization = new Finalization();
    private Ocr ocr = new Ocr();
    private Projects projects = new Projects();
    private Iiif iiif = new Iiif();
    private ApTrust aptrust = new ApTrust();
    private ArchivesSpace archivesspace = new ArchivesSpace();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Finalization {
        private long minImageSizeBytes = 1024L * 1024L;
        private int iiifBatchSize = 10;
        private int iiifConcurrency = 4;
    }

    @Data
    public static class Ocr {
        private Duration timeout = Duration.ofHours(4);
    }

    @Data
    public static class Projects {
        /**
         * Either "api" (remote project tracker) or "database" (local projects table).
         */
        private String mode = "api";
    }

    @Data
    public static class Iiif {
        private String bucket;
        private String stagingDir;
    }

    @Data
    public static class ApTrust {
        private String receivingBucket;
    }

    @Data
    public static class ArchivesSpace {
        private String user;
        private String password;
        private Duration sessionLifetime = Duration.ofMinutes(30);
    }
}
