package com.agentorchestra.orchestrator.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Tenant resolution for the HTTP boundary.
 *
 * The tenant is taken from the X-Tenant-Id header set by the gateway that
 * authenticated the caller. A request without it is unauthenticated.
 */
final class TenantHeader {

    static final String NAME = "X-Tenant-Id";

    private TenantHeader() {}

    static String require(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        return headerValue.strip();
    }
}
