package org.dpg.jobprocessor.common.apiclient.authentication;

import java.util.Map;

/**
 * Adds the credentials of one external service to the headers of an outgoing request.
 */
public interface Authentication {

    /**
     * @param authorization the mutable header map of the request being prepared.
     */
    void applyAuthentication(Map<String, String> authorization);
}
