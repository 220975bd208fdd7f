package org.dpg.jobprocessor.common.apiclient.projects.config;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.BearerTokenAuthentication;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Beans for the project tracker client: its {@link WebClient} and bearer-token {@link Authentication}.
 */
@Slf4j
@Configuration
public class ProjectsApiClientConfiguration {

    @Value("${app.clients.projects.baseurl}")
    private String baseUrl;

    @Value("${app.clients.projects.jwt}")
    private String token;

    @Bean("projectsWebClient")
    public WebClient projectsWebClient() {
        log.info("Initializing project tracker WebClient with base URL: {}", baseUrl);
        return WebClient.builder().baseUrl(baseUrl).build();
    }

    @Bean("projectsAuthentication")
    public Authentication projectsAuthentication() {
        if (token == null || token.isBlank()) {
            log.warn("Project tracker token is not configured. Project notifications may fail authentication.");
        }
        return new BearerTokenAuthentication(token);
    }
}
