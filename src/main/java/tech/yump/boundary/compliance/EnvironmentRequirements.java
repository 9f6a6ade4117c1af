package tech.yump.boundary.compliance;

import tech.yump.boundary.core.Environment;

/**
 * What an environment demands of the platform's security posture. Production is strictest; testing
 * and development share the permissive development profile.
 */
public record EnvironmentRequirements(
        boolean hardenedStoreRequired,
        boolean environmentFallbackAllowed,
        boolean csrfRequired,
        boolean csrfStrictMode,
        boolean rateLimitingRequired,
        boolean strictRateLimits,
        boolean securityHeadersRequired,
        boolean hstsRequired,
        boolean cspRequired,
        boolean tlsRequired,
        String tlsMinVersion,
        boolean auditLoggingRequired
) {

    public static EnvironmentRequirements forEnvironment(Environment environment) {
        return switch (environment) {
            case PRODUCTION -> new EnvironmentRequirements(
                    true, false,
                    true, true,
                    true, true,
                    true, true, true,
                    true, "1.2",
                    true);
            case STAGING -> new EnvironmentRequirements(
                    true, true,
                    true, true,
                    true, false,
                    true, false, true,
                    true, "1.2",
                    false);
            case DEVELOPMENT, TESTING -> new EnvironmentRequirements(
                    false, true,
                    false, false,
                    false, false,
                    false, false, false,
                    false, "1.0",
                    false);
        };
    }
}
