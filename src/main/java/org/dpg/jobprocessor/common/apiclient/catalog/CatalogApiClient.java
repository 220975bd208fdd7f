package org.dpg.jobprocessor.common.apiclient.catalog;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.NoAuthentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Client for the metadata API of the tracking system, which renders a record as MARC XML.
 */
@Slf4j
@Service("catalogApiClient")
public class CatalogApiClient extends ApiClient {

    public CatalogApiClient(@Qualifier("catalogWebClient") final WebClient webClient) {
        super(webClient, NoAuthentication.INSTANCE, HeaderConfig.none());
    }

    public byte[] fetchMarcXml(final String pid) {
        return call(ApiRequest.builder().method(HttpMethod.GET).path("/api/metadata/{pid}")
                              .queryParams(Map.of("type", "marc")).pathVariables(Map.of("pid", pid))
                              .acceptMediaType(MediaType.APPLICATION_XML).build()).getData();
    }
}
