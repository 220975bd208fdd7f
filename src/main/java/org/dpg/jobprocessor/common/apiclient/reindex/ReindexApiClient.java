package org.dpg.jobprocessor.common.apiclient.reindex;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.NoAuthentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.exception.apiclient.BadGatewayException;
import org.dpg.jobprocessor.exception.apiclient.GatewayTimeoutException;
import org.dpg.jobprocessor.exception.apiclient.ServiceUnavailableException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Client for the discovery index. Catalog records are reindexed by catalog key, locally described
 * XML records by metadata id.
 */
@Slf4j
@Service("reindexApiClient")
public class ReindexApiClient extends ApiClient {

    private final String xmlReindexPath;

    public ReindexApiClient(@Qualifier("reindexWebClient") final WebClient webClient,
                            @Value("${app.clients.reindex.xml-path}") final String xmlReindexPath) {
        super(webClient, NoAuthentication.INSTANCE, HeaderConfig.none());
        this.xmlReindexPath = xmlReindexPath;
    }

    @Override
    protected Duration requestTimeout() {
        return Duration.ofMinutes(2);
    }

    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.retry.delay-ms}}"),
            listeners = {"externalCallRetryListener"})
    public void reindexCatalogRecord(final String catalogKey) {
        log.info("Reindexing catalog record {}", catalogKey);
        call(ApiRequest.builder().method(HttpMethod.PUT).path("/api/reindex/{catalogKey}")
                       .pathVariables(Map.of("catalogKey", catalogKey)).build());
    }

    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.retry.delay-ms}}"),
            listeners = {"externalCallRetryListener"})
    public void reindexXmlRecord(final long metadataId) {
        log.info("Reindexing XML metadata record {}", metadataId);
        call(ApiRequest.builder().method(HttpMethod.PUT).path(xmlReindexPath + "/{metadataId}")
                       .pathVariables(Map.of("metadataId", metadataId)).build());
    }
}
