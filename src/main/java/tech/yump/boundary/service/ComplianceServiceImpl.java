package tech.yump.boundary.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.compliance.ComplianceReport;
import tech.yump.boundary.compliance.PlatformPosture;
import tech.yump.boundary.compliance.PortalType;
import tech.yump.boundary.compliance.SecurityComplianceAuditor;
import tech.yump.boundary.compliance.Severity;
import tech.yump.boundary.compliance.Violation;
import tech.yump.boundary.config.BoundaryProperties;
import tech.yump.boundary.csrf.CsrfPolicyEngine;
import tech.yump.boundary.secrets.SecretsPolicyEngine;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceServiceImpl implements ComplianceService {

    static final String PLATFORM_PORTAL = "platform";
    private static final String AUDIT_TYPE = "compliance";

    private final SecurityComplianceAuditor auditor;
    private final SecretsPolicyEngine secretsEngine;
    private final CsrfPolicyEngine csrfPolicyEngine;
    private final PlatformPosture platformPosture;
    private final BoundaryProperties properties;
    private final AuditHelper auditHelper;

    @Override
    public ComplianceReport currentReport() {
        ComplianceReport report = auditor.audit(PLATFORM_PORTAL, secretsEngine, csrfPolicyEngine.getPolicy(), platformPosture);
        recordAudit(report);
        return report;
    }

    @Override
    public ComplianceReport reportForPortal(PortalType portal) {
        Map<String, PlatformPosture.AdditionalCheck> checks = properties.compliance().portalChecks().getOrDefault(portal, Map.of());
        ComplianceReport report = auditor.audit(portal.portalName(), secretsEngine, csrfPolicyEngine.getPolicy(),
                platformPosture.withAdditionalChecks(checks));
        recordAudit(report);
        return report;
    }

    @Override
    public Map<PortalType, ComplianceReport> reportsForAllPortals() {
        Map<PortalType, ComplianceReport> reports = auditor.auditAllPortals(secretsEngine, csrfPolicyEngine.getPolicy(),
                platformPosture, properties.compliance().portalChecks());
        reports.values().forEach(this::recordAudit);
        return reports;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void auditOnStartup() {
        if (!properties.compliance().auditOnStartup()) {
            log.debug("Startup compliance audit disabled (boundary.compliance.audit-on-startup=false).");
            return;
        }
        ComplianceReport report = currentReport();
        if (report.compliant()) {
            log.info("Startup compliance audit: {} is compliant with score {} ({} passed checks, {} violation(s)).",
                    report.environment(), report.securityScore(), report.passedChecks().size(), report.violations().size());
        } else if (report.environment().isProduction()) {
            log.error("Startup compliance audit: PRODUCTION is NOT compliant (score {}). Critical violations: {}",
                    report.securityScore(), report.violationsBySeverity(Severity.CRITICAL).stream().map(Violation::message).toList());
        } else {
            log.warn("Startup compliance audit: {} is not compliant (score {}). Critical violations: {}",
                    report.environment(), report.securityScore(),
                    report.violationsBySeverity(Severity.CRITICAL).stream().map(Violation::message).toList());
        }
        for (Violation violation : report.violations()) {
            log.info("Compliance violation [{}] {}: {} (remediation: {})",
                    violation.severity(), violation.category(), violation.message(), violation.remediation());
        }
    }

    private void recordAudit(ComplianceReport report) {
        auditHelper.logInternalEvent(AUDIT_TYPE, "audit", report.compliant() ? "compliant" : "non_compliant", null,
                Map.of("portal", report.portalName(),
                        "environment", report.environment().name(),
                        "score", report.securityScore(),
                        "violations", report.violations().size()));
    }
}
