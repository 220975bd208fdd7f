package org.dpg.jobprocessor.common.apiclient.archivesspace.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class ArchivesSpaceApiClientConfiguration {

    @Value("${app.clients.archivesspace.baseurl}")
    private String baseUrl;

    @Bean("archivesSpaceWebClient")
    public WebClient archivesSpaceWebClient() {
        log.info("Initializing ArchivesSpace WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }
}
