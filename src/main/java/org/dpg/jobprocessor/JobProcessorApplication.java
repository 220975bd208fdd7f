package org.dpg.jobprocessor;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the job processor.
 * <p>
 * Every long-running request (unit finalization, OCR, publication, preservation submission) is tracked
 * as a job whose status and event log can be polled over HTTP.
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.processing" properties to
 *     {@link JobProcessingConfig}.</li>
 *     <li>{@link EnableScheduling}: runs the interrupted-job recovery on start-up.</li>
 *     <li>{@link EnableAsync}: enables the managed executors used by background jobs.</li>
 *     <li>{@link EnableRetry}: retries of idempotent calls to external services.</li>
 * </ul>
 */
@Slf4j
@EnableAsync
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "org.dpg.jobprocessor.repository")
@EnableConfigurationProperties(value = JobProcessingConfig.class)
@EnableRetry
public class JobProcessorApplication {

    public static void main(final String[] args) {
        log.info("Starting JobProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(JobProcessorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "dpg-jobprocessor"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
