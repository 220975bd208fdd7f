package org.dpg.jobprocessor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("DPG Job Processor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Starts the long-running work of the digitization pipeline and reports on it.

                                * **Jobs:** every request that starts background work answers with a job ID at once.
                                  Poll `/api/v1/jobs/{id}` and `/api/v1/jobs/{id}/events` for progress and outcome.
                                * **Finalization:** QA, image import, archiving, IIIF publication and patron deliverables for a unit.
                                * **Integrations:** OCR requests and callbacks, discovery reindexing, APTrust and ArchivesSpace.
                                """));
    }
}
