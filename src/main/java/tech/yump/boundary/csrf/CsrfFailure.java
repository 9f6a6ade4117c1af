package tech.yump.boundary.csrf;

/**
 * Specific reason a state-changing request failed CSRF checks. Logged and audited only.
 */
public enum CsrfFailure {
    NO_TOKEN_PRESENT,
    TOKEN_EXPIRED,
    SIGNATURE_INVALID,
    BINDING_MISMATCH,
    DOUBLE_SUBMIT_MISMATCH,
    REFERER_REJECTED
}
