package tech.yump.boundary.tenant;

/**
 * Registry entry for a tenant.
 */
public record TenantRecord(String tenantId, TenantStatus status) {
}
