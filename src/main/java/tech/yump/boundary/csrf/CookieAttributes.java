package tech.yump.boundary.csrf;

/**
 * Attributes applied to the CSRF cookie.
 *
 * @param sameSite {@code Strict}, {@code Lax} or {@code None}.
 */
public record CookieAttributes(boolean secure, boolean httpOnly, String sameSite, String path) {

    public static CookieAttributes defaults() {
        return new CookieAttributes(true, false, "Strict", "/");
    }
}
