package org.dpg.jobprocessor.common.apiclient.catalog.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class CatalogApiClientConfiguration {

    @Value("${app.clients.catalog.baseurl}")
    private String baseUrl;

    @Bean("catalogWebClient")
    public WebClient catalogWebClient() {
        log.info("Initializing catalog WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }
}
