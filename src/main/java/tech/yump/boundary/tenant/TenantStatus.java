package tech.yump.boundary.tenant;

/**
 * Lifecycle state of a tenant as held by the registry.
 */
public enum TenantStatus {
    ACTIVE,
    TRIAL,
    PENDING,
    SUSPENDED,
    DEACTIVATED;

    /**
     * Only active and trial tenants may be served.
     */
    public boolean isAdmissible() {
        return this == ACTIVE || this == TRIAL;
    }
}
