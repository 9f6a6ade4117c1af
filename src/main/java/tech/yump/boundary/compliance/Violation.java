package tech.yump.boundary.compliance;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A single failed compliance check.
 *
 * @param category           stable machine-readable check identifier, e.g. {@code csrf_disabled}.
 * @param complianceStandard internal control reference, when the check maps to one.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Violation(
        Severity severity,
        String category,
        String message,
        String portalName,
        String remediation,
        String complianceStandard
) {
}
