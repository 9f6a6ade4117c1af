package tech.yump.boundary.csrf;

import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.Optional;

/**
 * What the caller must add to the response to deliver a fresh token. The engine itself never
 * touches the response.
 *
 * @param headers      response headers to set.
 * @param cookie       cookie to set, or null.
 * @param metaTagToken token to render into the page's {@code csrf-token} meta tag, or null.
 */
public record CsrfResponseInstructions(Map<String, String> headers, @Nullable CsrfCookie cookie, @Nullable String metaTagToken) {

    public CsrfResponseInstructions {
        headers = Map.copyOf(headers);
    }

    public Optional<CsrfCookie> cookieToSet() {
        return Optional.ofNullable(cookie);
    }

    public Optional<String> metaTag() {
        return Optional.ofNullable(metaTagToken);
    }
}
