package tech.yump.boundary.csrf;

/**
 * How fresh tokens are handed to clients.
 */
public enum TokenDelivery {
    HEADER_ONLY,
    COOKIE_ONLY,
    BOTH,
    META_TAG;

    public boolean usesHeader() {
        return this == HEADER_ONLY || this == BOTH;
    }

    public boolean usesCookie() {
        return this == COOKIE_ONLY || this == BOTH;
    }
}
