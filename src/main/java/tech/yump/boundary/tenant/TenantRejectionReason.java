package tech.yump.boundary.tenant;

/**
 * Why a request was refused at the tenant boundary. Only logged and audited; clients see a generic 403.
 */
public enum TenantRejectionReason {
    MISSING_TENANT_CONTEXT,
    TENANT_CONTEXT_MISMATCH,
    UNKNOWN_OR_INACTIVE_TENANT,
    REGISTRY_UNAVAILABLE
}
