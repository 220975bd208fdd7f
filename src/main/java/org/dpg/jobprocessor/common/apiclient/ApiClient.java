package org.dpg.jobprocessor.common.apiclient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.ApiResponse;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.exception.apiclient.*;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class of the clients for the services a job calls out to. Runs one blocking request on the
 * subclass's {@link WebClient}, applies its {@link Authentication} and {@link HeaderConfig}, and turns
 * every non-2xx answer or transport failure into an {@link ApiException} subclass.
 * <p>
 * Jobs run on worker threads, so blocking here is expected.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    /**
     * How long one call may take. Override for services that do slow work synchronously.
     */
    protected Duration requestTimeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * Executes the request and returns the raw 2xx answer.
     *
     * @param apiRequest The API request to execute. Must not be null.
     * @return The API response; its data is an empty array when the service sent no body.
     * @throws ApiException If the service answered with an error status or could not be reached.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());
        log.debug("ApiRequest details: {}", apiRequest);

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(requestTimeout())
                                                     .onErrorMap(this::mapException).block();
            log.debug("Received response with status {}", apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;

        } catch (ApiException e) {
            log.error("Exception during API call {} {}", apiRequest.getMethod(), apiRequest.getPath(), e);
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call {} {}", apiRequest.getMethod(), apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.warn("Mapping exception: {}", error.getMessage());
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());

        } else if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        authentication.applyAuthentication(apiRequest.getHeaders());

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }

        apiRequest.getHeaders().forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        int statusCode = response.statusCode().value();

        if (response.statusCode().is2xxSuccessful()) {
            log.debug("Response was successful, statusCode {}", statusCode);
            return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0])
                           .map(data -> ApiResponse.builder().data(data).acceptType(headers.getContentType())
                                                   .headers(headers).statusCode(statusCode).timestamp(timestamp)
                                                   .build())
                           .onErrorMap(error -> new ApiException(
                                   "Error processing response: " + error.getMessage(), statusCode));
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return response.bodyToMono(String.class).defaultIfEmpty("")
                       .flatMap(body -> Mono.error(createException(body, statusCode)));
    }

    private ApiException createException(String body, int statusCode) {
        ApiException exception = switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 401 -> new UnauthorizedException(body);
            case 403 -> new ForbiddenException(body);
            case 404 -> new NotFoundException(body);
            case 409 -> new ConflictException(body);
            case 429 -> new TooManyRequestsException(body);
            case 500 -> new InternalServerException(body);
            case 502 -> new BadGatewayException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
        log.warn("Api request failing with {}: {}", statusCode, exception.getMessage());
        return exception;
    }
}
