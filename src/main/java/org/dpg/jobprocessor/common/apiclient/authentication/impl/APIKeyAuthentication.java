package org.dpg.jobprocessor.common.apiclient.authentication.impl;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;

import java.util.Map;

/**
 * Sends a static key in a named header, as the preservation registry expects.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying API key authentication.");
            return;
        }
        log.debug("Applying API key authentication using header: '{}'", headerName);
        authorization.put(headerName, apiKey);
    }
}
