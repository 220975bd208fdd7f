package org.dpg.jobprocessor.common.apiclient.projects;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.ApiResponse;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.common.json.JsonParser;
import org.dpg.jobprocessor.dto.project.ProjectFailedRequest;
import org.dpg.jobprocessor.dto.project.ProjectFinishedRequest;
import org.dpg.jobprocessor.dto.project.ProjectLookupResponse;
import org.dpg.jobprocessor.exception.apiclient.BadGatewayException;
import org.dpg.jobprocessor.exception.apiclient.GatewayTimeoutException;
import org.dpg.jobprocessor.exception.apiclient.ServiceUnavailableException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Client for the digitization project tracker that wraps a unit's human workflow.
 */
@Slf4j
@Service("projectsApiClient")
public class ProjectsApiClient extends ApiClient {

    private final JsonParser jsonParser;

    public ProjectsApiClient(@Qualifier("projectsWebClient") final WebClient webClient,
                             @Qualifier("projectsAuthentication") final Authentication authentication,
                             @Qualifier("jacksonJsonParser") final JsonParser jsonParser) {
        super(webClient, authentication, HeaderConfig.none());
        this.jsonParser = jsonParser;
    }

    public ProjectLookupResponse lookupByUnit(final long unitId) {
        final ApiResponse response = call(ApiRequest.builder().method(HttpMethod.GET).path("projects/lookup")
                                                    .queryParams(Map.of("unit", unitId))
                                                    .acceptMediaType(MediaType.APPLICATION_JSON).build());
        return jsonParser.parseObject(response.getData(), ProjectLookupResponse.class);
    }

    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.retry.delay-ms}}"),
            listeners = {"externalCallRetryListener"})
    public void finishProject(final long projectId, final long processingMins) {
        log.info("Marking project {} finished after {} minutes", projectId, processingMins);
        call(ApiRequest.builder().method(HttpMethod.POST).path("projects/{projectId}/done")
                       .pathVariables(Map.of("projectId", projectId))
                       .body(new ProjectFinishedRequest(processingMins)).build());
    }

    @Retryable(retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
            BadGatewayException.class},
            maxAttemptsExpression = "#{${app.processing.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.retry.delay-ms}}"),
            listeners = {"externalCallRetryListener"})
    public void failProject(final long projectId, final ProjectFailedRequest request) {
        log.info("Marking project {} failed: {}", projectId, request.reason());
        call(ApiRequest.builder().method(HttpMethod.POST).path("projects/{projectId}/fail")
                       .pathVariables(Map.of("projectId", projectId)).body(request).build());
    }
}
