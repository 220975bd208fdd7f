package org.dpg.jobprocessor.common.apiclient.ocr.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
public class OcrApiClientConfiguration {

    @Value("${app.clients.ocr.baseurl}")
    private String baseUrl;

    @Bean("ocrWebClient")
    public WebClient ocrWebClient() {
        log.info("Initializing OCR WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }
}
