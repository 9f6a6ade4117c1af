package tech.yump.boundary.web;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of an inbound request, as consumed by the tenant and CSRF engines.
 * Keeps those engines independent of the servlet API.
 */
public interface InboundRequest {

    String method();

    /**
     * Request path without the query string or context path.
     */
    String path();

    Optional<String> header(String name);

    Optional<String> cookie(String name);

    /**
     * Host name the client addressed, without port.
     */
    String host();

    /**
     * A field of a form-encoded body. Empty for non-form requests.
     */
    Optional<String> formField(String name);

    Optional<String> contentType();

    /**
     * Claims of an already verified bearer token; empty when the request carried none.
     */
    Map<String, Object> authClaims();
}
