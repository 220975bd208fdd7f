package org.dpg.jobprocessor.common.apiclient.authentication.impl;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * Sends a pre-issued token as {@code Authorization: Bearer <token>}. Used for the project tracker.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying bearer token authentication.");
            return;
        }
        authorization.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }
}
