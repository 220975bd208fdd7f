package org.dpg.jobprocessor.common.apiclient.authentication.impl;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;

import java.time.Instant;
import java.util.Map;

/**
 * A session token obtained by logging in, sent in a named header until it expires. The owning client
 * logs in again when {@link #isValid} turns false.
 */
@Slf4j
public class SessionTokenAuthentication implements Authentication {

    private final String headerName;
    private volatile Session session;

    public SessionTokenAuthentication(final String headerName) {
        this.headerName = headerName;
    }

    public boolean isValid(final Instant now) {
        final Session current = session;
        return current != null && now.isBefore(current.expiresAt());
    }

    public void update(final String token, final Instant expiresAt) {
        session = new Session(token, expiresAt);
        log.debug("Session for header '{}' valid until {}", headerName, expiresAt);
    }

    public void invalidate() {
        session = null;
    }

    @Override
    public void applyAuthentication(final Map<String, String> authorization) {
        final Session current = session;
        if (current != null && authorization != null) {
            authorization.put(headerName, current.token());
        }
    }

    private record Session(String token, Instant expiresAt) {
    }
}
