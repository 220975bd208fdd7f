package org.dpg.jobprocessor.common.apiclient.iiif;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.NoAuthentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.ApiResponse;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.common.json.JsonParser;
import org.dpg.jobprocessor.dto.iiif.IiifManifestStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Client for the IIIF manifest service, which builds and caches a manifest per metadata PID.
 */
@Slf4j
@Service("iiifManifestApiClient")
public class IiifManifestApiClient extends ApiClient {

    private final JsonParser jsonParser;
    private final String baseUrl;

    public IiifManifestApiClient(@Qualifier("iiifManifestWebClient") final WebClient webClient,
                                 @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                 @Value("${app.clients.iiif-manifest.baseurl}") final String baseUrl) {
        super(webClient, NoAuthentication.INSTANCE, HeaderConfig.none());
        this.jsonParser = jsonParser;
        this.baseUrl = baseUrl;
    }

    /**
     * A manifest refresh renders every page, which takes a while for large units.
     */
    @Override
    protected Duration requestTimeout() {
        return Duration.ofMinutes(10);
    }

    /**
     * Rebuilds the cached manifest of a record.
     */
    public void refreshManifest(final String pid) {
        log.info("Refreshing IIIF manifest for {}", pid);
        call(ApiRequest.builder().method(HttpMethod.GET).path("/pid/{pid}")
                       .queryParams(Map.of("refresh", "true")).pathVariables(Map.of("pid", pid)).build());
    }

    public IiifManifestStatus manifestStatus(final String pid) {
        final ApiResponse response = call(ApiRequest.builder().method(HttpMethod.GET).path("/pid/{pid}/exist")
                                                    .pathVariables(Map.of("pid", pid)).build());
        return jsonParser.parseObject(response.getData(), IiifManifestStatus.class);
    }

    /**
     * Public URL of the manifest of a record.
     */
    public String manifestUrl(final String pid) {
        return baseUrl + "/pid/" + pid;
    }
}
