package org.dpg.jobprocessor.common.apiclient.aptrust;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.ApiResponse;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.common.json.JsonParser;
import org.dpg.jobprocessor.dto.aptrust.ApTrustWorkItem;
import org.dpg.jobprocessor.dto.aptrust.ApTrustWorkItemList;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.Optional;

/**
 * Client for the preservation registry's member API.
 */
@Slf4j
@Service("apTrustApiClient")
public class ApTrustApiClient extends ApiClient {

    private final JsonParser jsonParser;

    public ApTrustApiClient(@Qualifier("apTrustWebClient") final WebClient webClient,
                            @Qualifier("apTrustAuthentication") final Authentication authentication,
                            @Qualifier("apTrustHeader") final HeaderConfig headerConfig,
                            @Qualifier("jacksonJsonParser") final JsonParser jsonParser) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
    }

    /**
     * Most recently processed ingest work item for a bag, if the registry has seen it at all.
     *
     * @param bagName file name of the bag, e.g. {@code virginia.edu.tracksys-sirsimetadata-42.tar}.
     */
    public Optional<ApTrustWorkItem> latestWorkItem(final String bagName) {
        try {
            final ApiResponse response = call(ApiRequest.builder().method(HttpMethod.GET).path("items")
                                                        .queryParams(Map.of("name", bagName,
                                                                            "sort", "date_processed__desc"))
                                                        .acceptMediaType(MediaType.APPLICATION_JSON).build());
            final ApTrustWorkItemList items = jsonParser.parseObject(response.getData(), ApTrustWorkItemList.class);
            if (items.count() == 0 || items.results() == null || items.results().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(items.results().get(0));
        } catch (final ApiException e) {
            log.warn("Registry status query for bag {} failed: {}", bagName, e.getMessage());
            throw e;
        }
    }
}
