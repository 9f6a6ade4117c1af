package tech.yump.boundary.compliance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import tech.yump.boundary.core.Environment;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one compliance audit. Recomputed on every request; never cached.
 *
 * @param compliant     true iff there is no {@link Severity#CRITICAL} violation.
 * @param securityScore {@code max(0, 100 - sum of violation weights)}.
 */
public record ComplianceReport(
        Environment environment,
        String portalName,
        boolean compliant,
        double securityScore,
        List<Violation> violations,
        List<String> passedChecks,
        Instant generatedAt
) {
    public ComplianceReport {
        violations = List.copyOf(violations);
        passedChecks = List.copyOf(passedChecks);
    }

    public List<Violation> violationsBySeverity(Severity severity) {
        return violations.stream().filter(v -> v.severity() == severity).toList();
    }

    @JsonIgnore
    public boolean hasCriticalViolations() {
        return !violationsBySeverity(Severity.CRITICAL).isEmpty();
    }

    public Map<Severity, Long> severityCounts() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, violations.stream().filter(v -> v.severity() == severity).count());
        }
        return counts;
    }
}
