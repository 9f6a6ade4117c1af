package tech.yump.boundary.csrf;

/**
 * Which traffic classes CSRF protection covers.
 */
public enum CsrfMode {
    /** Every request is treated as API traffic. */
    API_ONLY,
    /** Every request is treated as server-rendered traffic. */
    SSR_ONLY,
    /** Requests are classified by path and content type. */
    HYBRID,
    /** No protection; logged loudly at startup. */
    DISABLED
}
