package tech.yump.boundary.compliance;

import lombok.Builder;

import java.util.Map;

/**
 * Observed platform configuration the auditor checks beyond secrets and CSRF.
 *
 * @param declaredEnvironment value of the {@code ENVIRONMENT} variable, or blank when unset.
 * @param tlsMinVersion       minimum TLS protocol version accepted, e.g. {@code "1.2"}.
 * @param additionalChecks    portal-specific checks keyed by name.
 */
@Builder(toBuilder = true)
public record PlatformPosture(
        String declaredEnvironment,
        boolean debugEnabled,
        boolean httpsOnly,
        boolean securityHeadersEnabled,
        boolean hstsEnabled,
        boolean cspEnabled,
        boolean rateLimitingEnabled,
        boolean strictRateLimits,
        boolean tlsEnabled,
        String tlsMinVersion,
        boolean auditLoggingEnabled,
        Map<String, AdditionalCheck> additionalChecks
) {
    public PlatformPosture {
        additionalChecks = additionalChecks == null ? Map.of() : Map.copyOf(additionalChecks);
    }

    public PlatformPosture withAdditionalChecks(Map<String, AdditionalCheck> checks) {
        return toBuilder().additionalChecks(checks).build();
    }

    /**
     * A portal-specific control, e.g. MFA for the admin portal.
     */
    public record AdditionalCheck(boolean required, boolean configured, String remediation) {
    }
}
