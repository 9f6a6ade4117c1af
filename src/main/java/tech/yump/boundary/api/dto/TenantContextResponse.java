package tech.yump.boundary.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.boundary.tenant.TenantContext;

@Schema(description = "Tenant established for the current request")
public record TenantContextResponse(
        @Schema(description = "Tenant identifier.", example = "acme")
        String tenantId,
        @Schema(description = "Highest-priority source the tenant was read from.", example = "GATEWAY_HEADER")
        String source,
        @Schema(description = "Whether the API gateway asserted the same tenant.")
        boolean gatewayConfirmed
) {
    public static TenantContextResponse from(TenantContext context) {
        return new TenantContextResponse(context.tenantId(), context.source().name(), context.gatewayConfirmed());
    }
}
