package org.dpg.jobprocessor.common.apiclient.iiif.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class IiifManifestApiClientConfiguration {

    @Value("${app.clients.iiif-manifest.baseurl}")
    private String baseUrl;

    @Bean("iiifManifestWebClient")
    public WebClient iiifManifestWebClient() {
        log.info("Initializing IIIF manifest WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }
}
