package org.dpg.jobprocessor.common.apiclient.aptrust.config;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.APIKeyAuthentication;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Beans for the preservation registry client. The registry wants the user in one header and the
 * API key in another.
 */
@Slf4j
@Configuration
public class ApTrustApiClientConfiguration {

    @Value("${app.clients.aptrust.baseurl}")
    private String baseUrl;

    @Value("${app.clients.aptrust.user-header}")
    private String userHeader;

    @Value("${app.clients.aptrust.api-user}")
    private String apiUser;

    @Value("${app.clients.aptrust.key-header}")
    private String keyHeader;

    @Value("${app.clients.aptrust.api-key}")
    private String apiKey;

    @Bean("apTrustWebClient")
    public WebClient apTrustWebClient() {
        log.info("Initializing APTrust registry WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }

    @Bean("apTrustAuthentication")
    public Authentication apTrustAuthentication() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("APTrust API key is not configured. Registry status queries will fail authentication.");
        }
        return new APIKeyAuthentication(keyHeader, apiKey);
    }

    @Bean("apTrustHeader")
    public HeaderConfig apTrustHeader() {
        return HeaderConfig.of(userHeader, apiUser);
    }
}
