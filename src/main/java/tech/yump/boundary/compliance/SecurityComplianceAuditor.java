package tech.yump.boundary.compliance;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import tech.yump.boundary.core.Environment;
import tech.yump.boundary.csrf.CsrfMode;
import tech.yump.boundary.csrf.CsrfPolicy;
import tech.yump.boundary.secrets.ComplianceSnapshot;
import tech.yump.boundary.secrets.SecretsPolicyEngine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates secrets, CSRF and platform posture checks into a scored {@link ComplianceReport}.
 * <p>
 * Each check either records a passed-check name or a {@link Violation}. The score is
 * {@code max(0, 100 - sum of weights)} and a report is compliant iff it holds no critical violation.
 * The auditor only reads state; it never changes the configuration it inspects.
 */
@Slf4j
public class SecurityComplianceAuditor {

    @Getter
    private final Environment environment;
    @Getter
    private final EnvironmentRequirements requirements;
    private final SeverityWeights weights;
    private final Clock clock;

    public SecurityComplianceAuditor(Environment environment, SeverityWeights weights) {
        this(environment, EnvironmentRequirements.forEnvironment(environment), weights, Clock.systemUTC());
    }

    SecurityComplianceAuditor(Environment environment, EnvironmentRequirements requirements, SeverityWeights weights, Clock clock) {
        this.environment = environment;
        this.requirements = requirements;
        this.weights = weights;
        this.clock = clock;
    }

    /**
     * Audits one portal.
     *
     * @param secrets the secrets engine, or null when none is configured.
     * @param csrf    the active CSRF policy, or null when CSRF protection is not installed.
     */
    public ComplianceReport audit(String portalName, @Nullable SecretsPolicyEngine secrets, @Nullable CsrfPolicy csrf,
                                  PlatformPosture posture) {
        Checks checks = new Checks(portalName);
        try {
            checkSecrets(checks, secrets);
            checkCsrf(checks, csrf);
            checkEnvironment(checks, posture);
            checkSecurityHeaders(checks, posture);
            checkRateLimiting(checks, posture);
            checkTls(checks, posture);
            checkAuditLogging(checks, posture);
            checkAdditional(checks, posture.additionalChecks());
        } catch (RuntimeException e) {
            log.error("Security compliance audit for portal '{}' failed: {}", portalName, e.getMessage(), e);
            Violation failure = Violation.builder()
                    .severity(Severity.CRITICAL)
                    .category("validation_failure")
                    .message("Security validation process failed: " + e.getMessage())
                    .portalName(portalName)
                    .remediation("Fix validation process and retry")
                    .build();
            return new ComplianceReport(environment, portalName, false, 0, List.of(failure), List.of(), clock.instant());
        }

        double score = score(checks.violations);
        boolean compliant = checks.violations.stream().noneMatch(v -> v.severity() == Severity.CRITICAL);
        ComplianceReport report = new ComplianceReport(environment, portalName, compliant, score,
                checks.violations, checks.passed, clock.instant());
        log.info("Security compliance audit completed: environment={}, portal={}, compliant={}, score={}, violations={}, critical={}",
                environment, portalName, compliant, score, checks.violations.size(),
                report.violationsBySeverity(Severity.CRITICAL).size());
        return report;
    }

    /**
     * Audits every portal with the shared secrets and CSRF configuration, adding each portal's own checks.
     */
    public Map<PortalType, ComplianceReport> auditAllPortals(
            @Nullable SecretsPolicyEngine secrets,
            @Nullable CsrfPolicy csrf,
            PlatformPosture posture,
            Map<PortalType, Map<String, PlatformPosture.AdditionalCheck>> portalChecks) {
        Map<PortalType, ComplianceReport> reports = new EnumMap<>(PortalType.class);
        for (PortalType portal : PortalType.values()) {
            Map<String, PlatformPosture.AdditionalCheck> extra = portalChecks.getOrDefault(portal, Map.of());
            reports.put(portal, audit(portal.portalName(), secrets, csrf, posture.withAdditionalChecks(extra)));
        }
        return reports;
    }

    double score(List<Violation> violations) {
        double penalty = violations.stream().mapToDouble(v -> weights.weightOf(v.severity())).sum();
        return Math.max(0.0, 100.0 - Math.min(penalty, 100.0));
    }

    private void checkSecrets(Checks checks, @Nullable SecretsPolicyEngine secrets) {
        if (secrets == null || !secrets.hasHardenedStore()) {
            if (requirements.hardenedStoreRequired()) {
                checks.violation(Severity.CRITICAL, "secrets_management",
                        "Hardened secret store not configured but required",
                        "Configure boundary.secrets.hardened-store", "BOUNDARY-SEC-001");
            } else {
                checks.passed("secrets_manager_not_required");
            }
            if (secrets == null) {
                return;
            }
        }

        ComplianceSnapshot snapshot;
        try {
            snapshot = secrets.validateEnvironmentCompliance();
        } catch (RuntimeException e) {
            checks.violation(Severity.HIGH, "secrets_validation_error",
                    "Failed to validate secrets engine: " + e.getMessage(),
                    "Check secrets engine configuration", null);
            return;
        }

        if (!snapshot.compliant()) {
            Severity severity = requirements.hardenedStoreRequired() ? Severity.CRITICAL : Severity.HIGH;
            for (String message : snapshot.violations()) {
                checks.violation(severity, "secrets_compliance", message,
                        "Fix hardened secret store configuration", "BOUNDARY-SEC-002");
            }
        } else {
            checks.passed("secrets_compliance_valid");
        }

        if (requirements.hardenedStoreRequired() && secrets.hasHardenedStore()) {
            if (snapshot.hardenedStoreHealth() == null || !snapshot.hardenedStoreHealth().healthy()) {
                checks.violation(Severity.CRITICAL, "vault_health", "Hardened secret store not healthy",
                        "Check hardened store connectivity and seal status", "BOUNDARY-SEC-003");
            } else {
                checks.passed("hardened_store_healthy");
            }
        }

        if (snapshot.fallbackStoreActive()) {
            if (!requirements.environmentFallbackAllowed()) {
                checks.violation(Severity.CRITICAL, "env_fallback",
                        "Environment variable fallback active in " + environment,
                        "Serve all secrets from the hardened store", "BOUNDARY-SEC-004");
            } else {
                checks.passed("env_fallback_permitted");
            }
        }
    }

    private void checkCsrf(Checks checks, @Nullable CsrfPolicy csrf) {
        if (!requirements.csrfRequired()) {
            checks.passed("csrf_not_required");
            return;
        }
        if (csrf == null) {
            checks.violation(Severity.HIGH, "csrf_missing", "CSRF protection not configured but required",
                    "Configure boundary.csrf", "BOUNDARY-SEC-005");
            return;
        }
        if (csrf.mode() == CsrfMode.DISABLED) {
            checks.violation(Severity.HIGH, "csrf_disabled", "CSRF protection disabled in environment that requires it",
                    "Set boundary.csrf.mode to api-only, ssr-only or hybrid", "BOUNDARY-SEC-006");
            return;
        }
        checks.passed("csrf_protection_enabled");

        if (requirements.csrfStrictMode() && !csrf.requireRefererCheck()) {
            checks.violation(Severity.MEDIUM, "csrf_not_strict", "CSRF protection not in strict mode",
                    "Enable boundary.csrf.require-referer-check", null);
        } else {
            checks.passed("csrf_strict_mode_ok");
        }

        if (requirements.tlsRequired() && csrf.delivery().usesCookie() && !csrf.cookie().secure()) {
            checks.violation(Severity.MEDIUM, "csrf_cookie_insecure", "CSRF cookie is not marked Secure",
                    "Set boundary.csrf.cookie.secure=true", null);
        }
    }

    private void checkEnvironment(Checks checks, PlatformPosture posture) {
        String declared = posture.declaredEnvironment();
        if (StringUtils.hasText(declared) && Environment.fromLabel(declared) != environment) {
            checks.violation(Severity.MEDIUM, "env_mismatch",
                    "Environment variable (" + declared.trim() + ") doesn't match configured environment (" + environment + ")",
                    "Ensure ENVIRONMENT matches boundary.environment", null);
        } else {
            checks.passed("environment_consistent");
        }

        if (environment.isProduction()) {
            if (posture.debugEnabled()) {
                checks.violation(Severity.HIGH, "debug_in_production", "Debug mode enabled in production",
                        "Disable debug mode in production", "BOUNDARY-SEC-007");
            } else {
                checks.passed("debug_mode_disabled");
            }
        }
    }

    private void checkSecurityHeaders(Checks checks, PlatformPosture posture) {
        if (!requirements.securityHeadersRequired()) {
            checks.passed("security_headers_not_required");
            return;
        }
        if (posture.securityHeadersEnabled()) {
            checks.passed("security_headers_configured");
        } else {
            checks.violation(Severity.HIGH, "security_headers_missing", "Security headers not enabled",
                    "Enable boundary.posture.security-headers", null);
        }
        if (requirements.cspRequired()) {
            if (posture.cspEnabled()) {
                checks.passed("csp_configured");
            } else {
                checks.violation(Severity.MEDIUM, "csp_missing", "Content-Security-Policy not configured",
                        "Set boundary.posture.content-security-policy", null);
            }
        }
        if (requirements.hstsRequired()) {
            if (posture.hstsEnabled()) {
                checks.passed("hsts_configured");
            } else {
                checks.violation(Severity.MEDIUM, "hsts_missing", "HTTP Strict-Transport-Security not enabled",
                        "Enable boundary.posture.hsts", null);
            }
            if (environment.isProduction()) {
                if (posture.httpsOnly()) {
                    checks.passed("https_enforced");
                } else {
                    checks.violation(Severity.HIGH, "https_not_enforced", "HTTPS not enforced in production",
                            "Enable HTTPS enforcement (HTTPS_ONLY)", "BOUNDARY-SEC-008");
                }
            }
        }
    }

    private void checkRateLimiting(Checks checks, PlatformPosture posture) {
        if (!requirements.rateLimitingRequired()) {
            checks.passed("rate_limiting_not_required");
            return;
        }
        if (!posture.rateLimitingEnabled()) {
            checks.violation(Severity.HIGH, "rate_limiting_missing", "Rate limiting not enabled",
                    "Enable rate limiting in front of the platform", null);
            return;
        }
        checks.passed("rate_limiting_configured");
        if (requirements.strictRateLimits()) {
            if (posture.strictRateLimits()) {
                checks.passed("strict_rate_limits");
            } else {
                checks.violation(Severity.LOW, "rate_limits_not_strict", "Rate limits are not in strict mode",
                        "Enable strict rate limits for " + environment, null);
            }
        }
    }

    private void checkTls(Checks checks, PlatformPosture posture) {
        if (!requirements.tlsRequired()) {
            checks.passed("tls_not_required");
            return;
        }
        if (!posture.tlsEnabled()) {
            checks.violation(Severity.HIGH, "tls_disabled", "TLS not enabled", "Terminate TLS for all traffic", null);
        } else if (compareVersions(posture.tlsMinVersion(), requirements.tlsMinVersion()) < 0) {
            checks.violation(Severity.MEDIUM, "tls_version_too_low",
                    "Minimum TLS version " + posture.tlsMinVersion() + " is below required " + requirements.tlsMinVersion(),
                    "Raise the minimum TLS version to " + requirements.tlsMinVersion(), null);
        } else {
            checks.passed("tls_configured");
        }
    }

    private void checkAuditLogging(Checks checks, PlatformPosture posture) {
        if (!requirements.auditLoggingRequired()) {
            return;
        }
        if (posture.auditLoggingEnabled()) {
            checks.passed("audit_logging_enabled");
        } else {
            checks.violation(Severity.MEDIUM, "audit_logging_disabled", "Audit logging not enabled",
                    "Configure boundary.audit.backend", null);
        }
    }

    private void checkAdditional(Checks checks, Map<String, PlatformPosture.AdditionalCheck> additional) {
        additional.forEach((name, check) -> {
            if (!check.required()) {
                checks.passed("additional_" + name + "_not_required");
            } else if (check.configured()) {
                checks.passed("additional_" + name + "_configured");
            } else {
                checks.violation(Severity.MEDIUM, "additional_" + name,
                        "Additional security check '" + name + "' required but not configured",
                        StringUtils.hasText(check.remediation()) ? check.remediation() : "Configure " + name, null);
            }
        });
    }

    // Compares dotted numeric versions; missing or non-numeric parts count as 0.
    static int compareVersions(@Nullable String actual, String required) {
        String[] a = actual == null ? new String[0] : actual.trim().split("\\.");
        String[] r = required.trim().split("\\.");
        for (int i = 0; i < Math.max(a.length, r.length); i++) {
            int cmp = Integer.compare(part(a, i), part(r, i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int part(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[index]);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static final class Checks {
        private final String portalName;
        private final List<Violation> violations = new ArrayList<>();
        private final List<String> passed = new ArrayList<>();

        private Checks(String portalName) {
            this.portalName = portalName;
        }

        void passed(String check) {
            passed.add(check);
        }

        void violation(Severity severity, String category, String message, String remediation, @Nullable String standard) {
            violations.add(Violation.builder()
                    .severity(severity)
                    .category(category)
                    .message(message)
                    .portalName(portalName)
                    .remediation(remediation)
                    .complianceStandard(standard)
                    .build());
        }
    }
}
