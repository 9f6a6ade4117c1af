package tech.yump.boundary.tenant;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link TenantRegistry} serving a fixed list of tenants loaded from {@code boundary.tenant.registry}.
 */
@Slf4j
public class ConfiguredTenantRegistry implements TenantRegistry {

    private final Map<String, TenantRecord> tenants;

    public ConfiguredTenantRegistry(List<TenantRecord> records) {
        List<TenantRecord> configured = Optional.ofNullable(records).orElse(Collections.emptyList());
        if (configured.isEmpty()) {
            log.warn("No tenants configured (boundary.tenant.registry). Every non-exempt request will be rejected.");
            this.tenants = Collections.emptyMap();
        } else {
            this.tenants = configured.stream()
                    .collect(Collectors.toUnmodifiableMap(TenantRecord::tenantId, Function.identity(), (existing, replacement) -> {
                        log.warn("Duplicate tenant id in configuration: '{}'. Using the first occurrence.", existing.tenantId());
                        return existing;
                    }));
            log.info("Loaded {} tenant(s) from configuration.", tenants.size());
            log.debug("Configured tenant ids: {}", tenants.keySet());
        }
    }

    @Override
    public Optional<TenantRecord> getTenant(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }
}
