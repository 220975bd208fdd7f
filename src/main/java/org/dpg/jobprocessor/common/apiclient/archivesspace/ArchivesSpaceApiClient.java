package org.dpg.jobprocessor.common.apiclient.archivesspace;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.ApiClient;
import org.dpg.jobprocessor.common.apiclient.authentication.impl.SessionTokenAuthentication;
import org.dpg.jobprocessor.common.apiclient.model.ApiRequest;
import org.dpg.jobprocessor.common.apiclient.model.ApiResponse;
import org.dpg.jobprocessor.common.apiclient.model.HeaderConfig;
import org.dpg.jobprocessor.common.json.JsonParser;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.dto.archivesspace.ArchivesSpaceCreateResponse;
import org.dpg.jobprocessor.dto.archivesspace.ArchivesSpaceSession;
import org.dpg.jobprocessor.exception.apiclient.UnauthorizedException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Instant;
import java.util.Map;

/**
 * Client for the ArchivesSpace backend API. Logs in on first use and again once the cached session
 * has outlived {@code app.processing.archivesspace.session-lifetime}.
 */
@Slf4j
@Service("archivesSpaceApiClient")
public class ArchivesSpaceApiClient extends ApiClient {

    public static final String SESSION_HEADER = "X-ArchivesSpace-Session";

    private final JsonParser jsonParser;
    private final JobProcessingConfig config;

    public ArchivesSpaceApiClient(@Qualifier("archivesSpaceWebClient") final WebClient webClient,
                                  @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                  final JobProcessingConfig config) {
        super(webClient, new SessionTokenAuthentication(SESSION_HEADER), HeaderConfig.none());
        this.jsonParser = jsonParser;
        this.config = config;
    }

    /**
     * Loads a repository object (resource, archival object or accession) as a JSON tree so it can be
     * modified and posted back whole.
     *
     * @param path API path, e.g. {@code /repositories/3/archival_objects/1234}.
     */
    public JsonNode getObject(final String path) {
        ensureSession();
        final ApiResponse response = call(ApiRequest.builder().method(HttpMethod.GET).path(path)
                                                    .acceptMediaType(MediaType.APPLICATION_JSON).build());
        return jsonParser.parseObject(response.getData(), JsonNode.class);
    }

    public ArchivesSpaceCreateResponse createDigitalObject(final String repositoryId, final Object payload) {
        ensureSession();
        final ApiResponse response = call(ApiRequest.builder().method(HttpMethod.POST)
                                                    .path("/repositories/{repo}/digital_objects")
                                                    .pathVariables(Map.of("repo", repositoryId)).body(payload)
                                                    .build());
        return jsonParser.parseObject(response.getData(), ArchivesSpaceCreateResponse.class);
    }

    /**
     * Posts an updated object back to its own URI.
     */
    public void updateObject(final String uri, final JsonNode object) {
        ensureSession();
        call(ApiRequest.builder().method(HttpMethod.POST).path(uri).body(object).build());
    }

    private synchronized void ensureSession() {
        final SessionTokenAuthentication session = (SessionTokenAuthentication) authentication;
        final Instant now = Instant.now();
        if (session.isValid(now)) {
            return;
        }
        final JobProcessingConfig.ArchivesSpace as = config.getArchivesspace();
        log.info("Logging in to ArchivesSpace as {}", as.getUser());
        session.invalidate();

        final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("password", as.getPassword());
        final ApiResponse response = call(ApiRequest.builder().method(HttpMethod.POST).path("/users/{user}/login")
                                                    .pathVariables(Map.of("user", as.getUser())).body(form)
                                                    .contentType(MediaType.APPLICATION_FORM_URLENCODED).build());
        final ArchivesSpaceSession login = jsonParser.parseObject(response.getData(), ArchivesSpaceSession.class);
        if (login.session() == null || login.session().isBlank()) {
            throw new UnauthorizedException("ArchivesSpace login for " + as.getUser() + " returned no session");
        }
        session.update(login.session(), now.plus(as.getSessionLifetime()));
    }
}
