package org.dpg.jobprocessor.common.apiclient.reindex.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class ReindexApiClientConfiguration {

    @Value("${app.clients.reindex.baseurl}")
    private String baseUrl;

    @Bean("reindexWebClient")
    public WebClient reindexWebClient() {
        log.info("Initializing reindex WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }
}
