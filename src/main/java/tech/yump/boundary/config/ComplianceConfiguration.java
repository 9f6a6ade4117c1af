package tech.yump.boundary.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.boundary.compliance.PlatformPosture;
import tech.yump.boundary.compliance.SecurityComplianceAuditor;
import tech.yump.boundary.compliance.SeverityWeights;

@Configuration
@RequiredArgsConstructor
public class ComplianceConfiguration {

    private final BoundaryProperties properties;

    @Bean
    public SecurityComplianceAuditor securityComplianceAuditor() {
        return new SecurityComplianceAuditor(properties.environment(),
                SeverityWeights.of(properties.compliance().severityWeights()));
    }

    @Bean
    public PlatformPosture platformPosture() {
        // An AuditBackend is always configured, so audit logging is on.
        return properties.posture().toPosture(true);
    }
}
