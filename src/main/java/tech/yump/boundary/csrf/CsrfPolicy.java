package tech.yump.boundary.csrf;

import java.time.Duration;
import java.util.List;

/**
 * CSRF configuration for one deployment.
 *
 * @param allowedOrigins  origins ({@code scheme://host[:port]}) accepted by the referer check in addition
 *                        to the request's own host.
 * @param apiPathPrefixes paths classified as API traffic in {@link CsrfMode#HYBRID} mode.
 * @param ssrPathPrefixes paths classified as server-rendered traffic in {@link CsrfMode#HYBRID} mode.
 */
public record CsrfPolicy(
        CsrfMode mode,
        TokenDelivery delivery,
        boolean requireRefererCheck,
        List<String> allowedOrigins,
        CookieAttributes cookie,
        Duration tokenLifetime,
        List<String> apiPathPrefixes,
        List<String> ssrPathPrefixes
) {
    public CsrfPolicy {
        allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        apiPathPrefixes = apiPathPrefixes == null ? List.of() : List.copyOf(apiPathPrefixes);
        ssrPathPrefixes = ssrPathPrefixes == null ? List.of() : List.copyOf(ssrPathPrefixes);
        cookie = cookie == null ? CookieAttributes.defaults() : cookie;
        tokenLifetime = tokenLifetime == null ? CsrfTokenCodec.DEFAULT_LIFETIME : tokenLifetime;
    }

    public boolean isEnabled() {
        return mode != CsrfMode.DISABLED;
    }
}
