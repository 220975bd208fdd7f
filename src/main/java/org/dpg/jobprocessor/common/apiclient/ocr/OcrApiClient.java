package org.dpg.jobprocessor.common.apiclient.ocr;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.NoAuthentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.exception.apiclient.*;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.lang.Nullable;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for the OCR service. A request is only accepted here; the result arrives later through the
 * callback URL passed along with it.
 */
@Slf4j
@Service("ocrApiClient")
public class OcrApiClient extends ApiClient {

    public OcrApiClient(@Qualifier("ocrWebClient") final WebClient webClient) {
        super(webClient, NoAuthentication.INSTANCE, HeaderConfig.none());
    }

    /**
     * Asks the OCR service to transcribe every master file of a metadata record's unit, or one master file.
     *
     * @param pid         PID of the metadata record (unit request) or the master file.
     * @param language    OCR language hint, e.g. {@code eng}.
     * @param unitId      unit to restrict a metadata request to; {@code null} for a master file.
     * @param callbackUrl where the service reports completion.
     */
    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.retry.delay-ms}}"),
            listeners = {"externalCallRetryListener"})
    public void requestOcr(final String pid, final String language, @Nullable final Long unitId,
                           final String callbackUrl) {
        final Map<String, Object> query = new LinkedHashMap<>();
        query.put("lang", language);
        if (unitId != null) {
            query.put("unit", unitId);
        }
        query.put("force", "true");
        query.put("callback", "{callback}");

        final Map<String, Object> pathVariables = new HashMap<>();
        pathVariables.put("pid", pid);
        pathVariables.put("callback", callbackUrl);

        try {
            call(ApiRequest.builder().method(HttpMethod.GET).path("/{pid}").queryParams(query)
                           .pathVariables(pathVariables).build());
            log.info("OCR request for {} accepted; callback {}", pid, callbackUrl);
        } catch (final ApiException e) {
            log.warn("OCR service rejected request for {}: {}", pid, e.getMessage());
            throw e;
        }
    }
}
