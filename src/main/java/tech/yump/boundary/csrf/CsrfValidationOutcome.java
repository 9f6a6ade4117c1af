package tech.yump.boundary.csrf;

/**
 * Result of checking a token with {@link CsrfTokenCodec#verify}.
 */
public enum CsrfValidationOutcome {
    VALID,
    MALFORMED,
    EXPIRED,
    SIGNATURE_INVALID,
    BINDING_MISMATCH
}
