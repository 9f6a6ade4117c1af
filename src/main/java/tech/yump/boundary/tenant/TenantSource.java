package tech.yump.boundary.tenant;

/**
 * Where a tenant identifier candidate was found. Declaration order is priority order: when candidates
 * agree, the first source in this list is reported as primary.
 */
public enum TenantSource {
    GATEWAY_HEADER,
    CONTAINER_CONTEXT,
    AUTH_TOKEN,
    SUBDOMAIN
}
