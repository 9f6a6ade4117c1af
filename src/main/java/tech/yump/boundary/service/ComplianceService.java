package tech.yump.boundary.service;

import tech.yump.boundary.compliance.ComplianceReport;
import tech.yump.boundary.compliance.PortalType;

import java.util.Map;

/**
 * Runs the security compliance audit against the live configuration of this process.
 * Every call re-reads state, including a health probe of the hardened secret store.
 */
public interface ComplianceService {

    /**
     * Audits the platform as a whole, without portal-specific checks.
     */
    ComplianceReport currentReport();

    /**
     * Audits one portal, including its configured additional checks.
     */
    ComplianceReport reportForPortal(PortalType portal);

    Map<PortalType, ComplianceReport> reportsForAllPortals();
}
