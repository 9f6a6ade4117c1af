package tech.yump.boundary.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.boundary.tenant.ConfiguredTenantRegistry;
import tech.yump.boundary.tenant.TenantBoundaryEnforcer;
import tech.yump.boundary.tenant.TenantContextExtractor;
import tech.yump.boundary.tenant.TenantRegistry;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class TenantConfiguration {

    private final BoundaryProperties properties;

    @Bean
    @ConditionalOnMissingBean(TenantRegistry.class)
    public TenantRegistry tenantRegistry() {
        log.info("Using configured tenant registry (boundary.tenant.registry) with {} tenant(s).",
                properties.tenant().registry().size());
        return new ConfiguredTenantRegistry(properties.tenant().registryRecords());
    }

    @Bean
    public TenantContextExtractor tenantContextExtractor() {
        BoundaryProperties.TenantProperties tenant = properties.tenant();
        return new TenantContextExtractor(tenant.gatewayHeader(), tenant.containerHeader(), tenant.tokenClaim(),
                tenant.baseDomain(), tenant.reservedSubdomains());
    }

    @Bean
    public TenantBoundaryEnforcer tenantBoundaryEnforcer(TenantContextExtractor extractor, TenantRegistry registry) {
        log.debug("Tenant boundary exempt paths: {}", properties.tenant().exemptPaths());
        return new TenantBoundaryEnforcer(extractor, registry, properties.tenant().exemptPaths());
    }
}
