package tech.yump.boundary.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.boundary.api.ApiError;
import tech.yump.boundary.api.dto.TenantContextResponse;
import tech.yump.boundary.auth.TenantBoundaryFilter;
import tech.yump.boundary.tenant.EnforcementStage;
import tech.yump.boundary.tenant.TenantBoundaryException;
import tech.yump.boundary.tenant.TenantContext;
import tech.yump.boundary.tenant.TenantRejectionReason;

@Slf4j
@RestController
@RequestMapping("/api/v1/tenant")
@Tag(name = "Tenant", description = "Inspect the tenant established for the current request")
public class TenantController {

    @GetMapping
    @Operation(summary = "Current tenant",
            description = "Returns the tenant the boundary resolved for this request.")
    @ApiResponse(responseCode = "200", description = "Tenant resolved.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = TenantContextResponse.class)))
    @ApiResponse(responseCode = "403", description = "No valid tenant context.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    public TenantContextResponse currentTenant(HttpServletRequest request) {
        return TenantContextResponse.from(requireTenant(request));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify a state-changing request",
            description = "Passes only when both the tenant boundary and CSRF protection accept the request; "
                    + "lets clients confirm their token handling.")
    @ApiResponse(responseCode = "200", description = "Request accepted.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = TenantContextResponse.class)))
    @ApiResponse(responseCode = "403", description = "Rejected by the tenant boundary or CSRF protection.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    public TenantContextResponse verify(HttpServletRequest request) {
        TenantContext tenant = requireTenant(request);
        log.debug("State-changing request verified for tenant '{}'", tenant.tenantId());
        return TenantContextResponse.from(tenant);
    }

    private TenantContext requireTenant(HttpServletRequest request) {
        return TenantBoundaryFilter.currentTenant(request)
                .orElseThrow(() -> new TenantBoundaryException(TenantRejectionReason.MISSING_TENANT_CONTEXT,
                        EnforcementStage.NO_CONTEXT, "Tenant-scoped endpoint reached without a tenant context"));
    }
}
