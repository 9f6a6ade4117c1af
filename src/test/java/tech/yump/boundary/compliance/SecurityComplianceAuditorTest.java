package tech.yump.boundary.compliance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.core.Environment;
import tech.yump.boundary.csrf.CookieAttributes;
import tech.yump.boundary.csrf.CsrfMode;
import tech.yump.boundary.csrf.CsrfPolicy;
import tech.yump.boundary.csrf.TokenDelivery;
import tech.yump.boundary.secrets.SecretPolicyTable;
import tech.yump.boundary.secrets.SecretsPolicyEngine;
import tech.yump.boundary.storage.InMemorySecretStore;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecurityComplianceAuditorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private AuditHelper auditHelper;

    private static PlatformPosture fullPosture(String declared) {
        return PlatformPosture.builder()
                .declaredEnvironment(declared)
                .debugEnabled(false)
                .httpsOnly(true)
                .securityHeadersEnabled(true)
                .hstsEnabled(true)
                .cspEnabled(true)
                .rateLimitingEnabled(true)
                .strictRateLimits(true)
                .tlsEnabled(true)
                .tlsMinVersion("1.3")
                .auditLoggingEnabled(true)
                .build();
    }

    private static CsrfPolicy strictCsrf() {
        return new CsrfPolicy(CsrfMode.HYBRID, TokenDelivery.BOTH, true, List.of(), CookieAttributes.defaults(),
                Duration.ofHours(1), List.of("/api/"), List.of("/portal/"));
    }

    private SecretsPolicyEngine engineWithStore(Environment environment, InMemorySecretStore store) {
        return new SecretsPolicyEngine(environment, store, SecretPolicyTable.defaults(), Map.of(), TIMEOUT, auditHelper);
    }

    private static SecurityComplianceAuditor auditor(Environment environment) {
        return new SecurityComplianceAuditor(environment, SeverityWeights.defaults());
    }

    @Test
    @DisplayName("Fully configured production scores 100 and is compliant")
    void production_fullyConfigured_shouldScore100() {
        ComplianceReport report = auditor(Environment.PRODUCTION).audit("platform",
                engineWithStore(Environment.PRODUCTION, new InMemorySecretStore()), strictCsrf(), fullPosture("production"));

        assertThat(report.violations()).isEmpty();
        assertThat(report.securityScore()).isEqualTo(100);
        assertThat(report.compliant()).isTrue();
        assertThat(report.passedChecks()).contains("secrets_compliance_valid", "hardened_store_healthy",
                "csrf_protection_enabled", "https_enforced", "tls_configured", "audit_logging_enabled");
    }

    @Test
    @DisplayName("Production without a hardened store loses at least 25 points and is non-compliant")
    void production_withoutHardenedStore_shouldBeNonCompliant() {
        ComplianceReport report = auditor(Environment.PRODUCTION).audit("platform", null, strictCsrf(), fullPosture("production"));

        assertThat(report.securityScore()).isLessThanOrEqualTo(75);
        assertThat(report.compliant()).isFalse();
        assertThat(report.hasCriticalViolations()).isTrue();
        assertThat(report.violations()).extracting(Violation::category).contains("secrets_management");
    }

    @Test
    void production_withSealedStore_shouldReportStoreHealth() {
        InMemorySecretStore store = new InMemorySecretStore();
        store.setHealthy(false);

        ComplianceReport report = auditor(Environment.PRODUCTION).audit("platform",
                engineWithStore(Environment.PRODUCTION, store), strictCsrf(), fullPosture("production"));

        assertThat(report.compliant()).isFalse();
        assertThat(report.violationsBySeverity(Severity.CRITICAL)).extracting(Violation::category)
                .contains("secrets_compliance", "vault_health");
    }

    @Test
    void production_withWeakPosture_shouldCollectNonCriticalViolations() {
        PlatformPosture weak = fullPosture("staging").toBuilder()
                .debugEnabled(true)
                .httpsOnly(false)
                .tlsMinVersion("1.1")
                .strictRateLimits(false)
                .build();
        CsrfPolicy disabled = new CsrfPolicy(CsrfMode.DISABLED, TokenDelivery.BOTH, false, null, null, null, null, null);

        ComplianceReport report = auditor(Environment.PRODUCTION).audit("platform",
                engineWithStore(Environment.PRODUCTION, new InMemorySecretStore()), disabled, weak);

        assertThat(report.violations()).extracting(Violation::category).containsExactlyInAnyOrder(
                "csrf_disabled", "env_mismatch", "debug_in_production", "https_not_enforced",
                "rate_limits_not_strict", "tls_version_too_low");
        assertThat(report.compliant()).isTrue();
        // HIGH 15 * 3 + MEDIUM 10 * 2 + LOW 5
        assertThat(report.securityScore()).isEqualTo(100 - 45 - 20 - 5);
    }

    @Test
    void development_shouldBePermissive() {
        SecretsPolicyEngine devEngine = new SecretsPolicyEngine(Environment.DEVELOPMENT, null, SecretPolicyTable.defaults(),
                Map.of(), TIMEOUT, auditHelper);
        PlatformPosture bare = PlatformPosture.builder().declaredEnvironment("dev").build();

        ComplianceReport report = auditor(Environment.DEVELOPMENT).audit("platform", devEngine, null, bare);

        assertThat(report.compliant()).isTrue();
        assertThat(report.securityScore()).isEqualTo(100);
        assertThat(report.passedChecks()).contains("secrets_manager_not_required", "env_fallback_permitted",
                "csrf_not_required", "environment_consistent");
    }

    @Test
    void staging_withoutHardenedStore_shouldBeCritical() {
        SecretsPolicyEngine engine = new SecretsPolicyEngine(Environment.STAGING, null, SecretPolicyTable.defaults(),
                Map.of(), TIMEOUT, auditHelper);

        ComplianceReport report = auditor(Environment.STAGING).audit("platform", engine, strictCsrf(), fullPosture("staging"));

        assertThat(report.compliant()).isFalse();
        assertThat(report.violationsBySeverity(Severity.CRITICAL)).extracting(Violation::complianceStandard)
                .contains("BOUNDARY-SEC-001");
    }

    @Test
    void auditAllPortals_shouldApplyPortalSpecificChecks() {
        Map<PortalType, Map<String, PlatformPosture.AdditionalCheck>> portalChecks = Map.of(
                PortalType.ADMIN, Map.of("mfa-enforced", new PlatformPosture.AdditionalCheck(true, false, "Enable MFA")));

        Map<PortalType, ComplianceReport> reports = auditor(Environment.PRODUCTION).auditAllPortals(
                engineWithStore(Environment.PRODUCTION, new InMemorySecretStore()), strictCsrf(), fullPosture("prod"), portalChecks);

        assertThat(reports).hasSize(PortalType.values().length);
        assertThat(reports.get(PortalType.ADMIN).violations()).singleElement().satisfies(v -> {
            assertThat(v.category()).isEqualTo("additional_mfa-enforced");
            assertThat(v.severity()).isEqualTo(Severity.MEDIUM);
            assertThat(v.portalName()).isEqualTo("admin");
            assertThat(v.remediation()).isEqualTo("Enable MFA");
        });
        assertThat(reports.get(PortalType.CUSTOMER).securityScore()).isEqualTo(100);
    }

    @Test
    void unexpectedFailure_shouldYieldSingleCriticalViolation() {
        SecretsPolicyEngine broken = mock(SecretsPolicyEngine.class);
        when(broken.hasHardenedStore()).thenThrow(new IllegalStateException("boom"));

        ComplianceReport report = auditor(Environment.PRODUCTION).audit("platform", broken, strictCsrf(), fullPosture("production"));

        assertThat(report.securityScore()).isZero();
        assertThat(report.compliant()).isFalse();
        assertThat(report.violations()).singleElement().satisfies(v -> {
            assertThat(v.category()).isEqualTo("validation_failure");
            assertThat(v.severity()).isEqualTo(Severity.CRITICAL);
        });
    }

    @Test
    void score_shouldBeMonotonicAndFloorAtZero() {
        SecurityComplianceAuditor auditor = auditor(Environment.PRODUCTION);
        Violation high = Violation.builder().severity(Severity.HIGH).category("x").message("x").build();
        Violation critical = Violation.builder().severity(Severity.CRITICAL).category("y").message("y").build();

        assertThat(auditor.score(List.of())).isEqualTo(100);
        assertThat(auditor.score(List.of(high))).isEqualTo(85);
        assertThat(auditor.score(List.of(high, critical))).isEqualTo(60);
        assertThat(auditor.score(List.of(critical, critical, critical, critical, critical))).isZero();
    }

    @Test
    void customWeights_shouldChangeScore() {
        SecurityComplianceAuditor auditor = new SecurityComplianceAuditor(Environment.PRODUCTION,
                SeverityWeights.of(Map.of(Severity.HIGH, 40.0)));
        Violation high = Violation.builder().severity(Severity.HIGH).category("x").message("x").build();

        assertThat(auditor.score(List.of(high))).isEqualTo(60);
    }

    @Test
    void fractionalWeights_shouldNotBeTruncated() {
        SecurityComplianceAuditor auditor = new SecurityComplianceAuditor(Environment.PRODUCTION,
                SeverityWeights.of(Map.of(Severity.LOW, 2.5, Severity.MEDIUM, 7.25)));
        Violation low = Violation.builder().severity(Severity.LOW).category("x").message("x").build();
        Violation medium = Violation.builder().severity(Severity.MEDIUM).category("y").message("y").build();

        assertThat(auditor.score(List.of(low))).isEqualTo(97.5);
        assertThat(auditor.score(List.of(low, medium))).isEqualTo(90.25);
    }

    @Test
    void compareVersions_shouldCompareNumerically() {
        assertThat(SecurityComplianceAuditor.compareVersions("1.2", "1.2")).isZero();
        assertThat(SecurityComplianceAuditor.compareVersions("1.10", "1.2")).isPositive();
        assertThat(SecurityComplianceAuditor.compareVersions("1.1", "1.2")).isNegative();
        assertThat(SecurityComplianceAuditor.compareVersions(null, "1.2")).isNegative();
    }
}
