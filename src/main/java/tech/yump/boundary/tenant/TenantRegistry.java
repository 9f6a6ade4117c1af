package tech.yump.boundary.tenant;

import java.util.Optional;

/**
 * Source of truth for which tenants exist and in what state. Implementations are provided by the
 * surrounding platform; {@link ConfiguredTenantRegistry} serves a static list from configuration.
 */
public interface TenantRegistry {

    /**
     * Looks up a tenant.
     *
     * @param tenantId A syntactically valid tenant id.
     * @return The registry record, or empty if the tenant is unknown.
     * @throws RuntimeException If the registry cannot be consulted; callers fail closed.
     */
    Optional<TenantRecord> getTenant(String tenantId);
}
