package tech.yump.boundary.csrf;

import java.time.Duration;

/**
 * A cookie the caller should set on the response.
 */
public record CsrfCookie(String name, String value, CookieAttributes attributes, Duration maxAge) {
}
