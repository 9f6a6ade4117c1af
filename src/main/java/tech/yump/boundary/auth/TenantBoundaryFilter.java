package tech.yump.boundary.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.tenant.TenantBoundaryEnforcer;
import tech.yump.boundary.tenant.TenantBoundaryException;
import tech.yump.boundary.tenant.TenantContext;
import tech.yump.boundary.web.ServletInboundRequest;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Runs {@link TenantBoundaryEnforcer} for every request. A validated {@link TenantContext} is exposed as
 * the {@value #TENANT_CONTEXT_ATTR} request attribute and the {@code tenantId} MDC key for the duration of
 * the request only. Rejections answer with a generic 403.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantBoundaryFilter extends OncePerRequestFilter {

    public static final String TENANT_CONTEXT_ATTR = "boundary.tenantContext";
    private static final String AUDIT_TYPE = "tenant_boundary";

    private final TenantBoundaryEnforcer enforcer;
    private final AuditHelper auditHelper;
    private final ObjectMapper objectMapper;

    public static Optional<TenantContext> currentTenant(HttpServletRequest request) {
        Object attribute = request.getAttribute(TENANT_CONTEXT_ATTR);
        return attribute instanceof TenantContext context ? Optional.of(context) : Optional.empty();
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        Optional<TenantContext> tenant;
        try {
            tenant = enforcer.enforce(new ServletInboundRequest(request));
        } catch (TenantBoundaryException e) {
            auditHelper.logHttpEvent(request, AUDIT_TYPE, "enforce", "denied", HttpStatus.FORBIDDEN.value(),
                    e.getMessage(), Map.of("reason", e.getReason().name(), "stage", e.getStage().name()));
            ForbiddenResponses.write(response, objectMapper);
            return;
        }

        if (tenant.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        TenantContext context = tenant.get();
        request.setAttribute(TENANT_CONTEXT_ATTR, context);
        MDC.put(AuditHelper.MDC_TENANT_ID_KEY, context.tenantId());
        try {
            auditHelper.logHttpEvent(request, AUDIT_TYPE, "enforce", "granted", HttpStatus.OK.value(), null,
                    Map.of("source", context.source().name(), "gateway_confirmed", context.gatewayConfirmed()));
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(AuditHelper.MDC_TENANT_ID_KEY);
            request.removeAttribute(TENANT_CONTEXT_ATTR);
        }
    }
}
