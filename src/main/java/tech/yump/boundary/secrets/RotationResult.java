package tech.yump.boundary.secrets;

import java.time.Instant;

/**
 * Outcome of a rotation. Carries no secret value, old or new; callers read the
 * new value back through {@link SecretsPolicyEngine#getSecret}.
 */
public record RotationResult(SecretAddress address, Instant rotatedAt, boolean stored) {
}
