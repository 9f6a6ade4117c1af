package tech.yump.boundary.tenant;

/**
 * Tenant identity for one request. Exists only for the lifetime of that request.
 *
 * @param validated        true once the identity was reconciled and confirmed against the registry.
 * @param gatewayConfirmed true when the API gateway header asserted the same tenant.
 */
public record TenantContext(String tenantId, TenantSource source, boolean validated, boolean gatewayConfirmed) {

    static TenantContext candidate(String tenantId, TenantSource source) {
        return new TenantContext(tenantId, source, false, false);
    }

    TenantContext validated(boolean gatewayConfirmed) {
        return new TenantContext(tenantId, source, true, gatewayConfirmed);
    }
}
