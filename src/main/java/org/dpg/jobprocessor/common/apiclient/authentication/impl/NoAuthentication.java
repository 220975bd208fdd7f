package org.dpg.jobprocessor.common.apiclient.authentication.impl;

import org.dpg.jobprocessor.common.apiclient.authentication.Authentication;

import java.util.Map;

/**
 * For the internal services (OCR, reindex, IIIF manifest, catalog) that sit behind the network boundary.
 */
public enum NoAuthentication implements Authentication {
    INSTANCE;

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        // nothing to add
    }
}
