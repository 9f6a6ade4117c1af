package tech.yump.boundary.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.tenant.EnforcementStage;
import tech.yump.boundary.tenant.TenantBoundaryEnforcer;
import tech.yump.boundary.tenant.TenantBoundaryException;
import tech.yump.boundary.tenant.TenantContext;
import tech.yump.boundary.tenant.TenantRejectionReason;
import tech.yump.boundary.tenant.TenantSource;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantBoundaryFilterTest {

    @Mock
    private TenantBoundaryEnforcer enforcer;
    @Mock
    private AuditHelper auditHelper;
    @Mock
    private FilterChain filterChain;

    private TenantBoundaryFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new TenantBoundaryFilter(enforcer, auditHelper, new ObjectMapper().findAndRegisterModules());
        request = new MockHttpServletRequest("GET", "/api/v1/tenant");
        response = new MockHttpServletResponse();
    }

    @Test
    @DisplayName("Rejected request gets a generic 403 and never reaches the chain")
    void doFilterInternal_whenEnforcerRejects_shouldWriteForbidden() throws Exception {
        when(enforcer.enforce(any())).thenThrow(new TenantBoundaryException(
                TenantRejectionReason.TENANT_CONTEXT_MISMATCH, EnforcementStage.RECONCILED, "gateway and container disagree"));

        filter.doFilterInternal(request, response, filterChain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString())
                .contains("\"message\":\"Access denied.\"")
                .doesNotContain("disagree")
                .doesNotContain("TENANT_CONTEXT_MISMATCH");
        verify(filterChain, never()).doFilter(any(), any());
        verify(auditHelper).logHttpEvent(eq(request), eq("tenant_boundary"), eq("enforce"), eq("denied"), eq(403),
                eq("gateway and container disagree"),
                eq(Map.of("reason", "TENANT_CONTEXT_MISMATCH", "stage", "RECONCILED")));
    }

    @Test
    void doFilterInternal_whenTenantValidated_shouldExposeContextOnlyDuringChain() throws Exception {
        TenantContext context = new TenantContext("acme", TenantSource.GATEWAY_HEADER, true, true);
        when(enforcer.enforce(any())).thenReturn(Optional.of(context));
        doAnswer(invocation -> {
            assertThat(TenantBoundaryFilter.currentTenant(request)).contains(context);
            assertThat(MDC.get(AuditHelper.MDC_TENANT_ID_KEY)).isEqualTo("acme");
            return null;
        }).when(filterChain).doFilter(request, response);

        filter.doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        assertThat(TenantBoundaryFilter.currentTenant(request)).isEmpty();
        assertThat(MDC.get(AuditHelper.MDC_TENANT_ID_KEY)).isNull();
        verify(auditHelper).logHttpEvent(eq(request), eq("tenant_boundary"), eq("enforce"), eq("granted"), eq(200),
                isNull(), eq(Map.of("source", "GATEWAY_HEADER", "gateway_confirmed", true)));
    }

    @Test
    void doFilterInternal_whenChainThrows_shouldStillClearTenantContext() throws Exception {
        when(enforcer.enforce(any())).thenReturn(Optional.of(new TenantContext("acme", TenantSource.SUBDOMAIN, true, false)));
        doAnswer(invocation -> {
            throw new IllegalStateException("downstream failure");
        }).when(filterChain).doFilter(request, response);

        try {
            filter.doFilterInternal(request, response, filterChain);
        } catch (IllegalStateException expected) {
            assertThat(expected).hasMessage("downstream failure");
        }

        assertThat(request.getAttribute(TenantBoundaryFilter.TENANT_CONTEXT_ATTR)).isNull();
        assertThat(MDC.get(AuditHelper.MDC_TENANT_ID_KEY)).isNull();
    }

    @Test
    void doFilterInternal_forExemptPath_shouldPassThroughWithoutContext() throws Exception {
        request.setRequestURI("/sys/compliance");
        when(enforcer.enforce(any())).thenReturn(Optional.empty());

        filter.doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(TenantBoundaryFilter.currentTenant(request)).isEmpty();
        verifyNoInteractions(auditHelper);
    }

    @Test
    void doFilterInternal_whenRegistryUnavailable_shouldFailClosed() throws Exception {
        when(enforcer.enforce(any())).thenThrow(new TenantBoundaryException(
                TenantRejectionReason.REGISTRY_UNAVAILABLE, EnforcementStage.CANDIDATES_GATHERED, "registry lookup failed",
                new IllegalStateException("connection refused")));

        filter.doFilterInternal(request, response, filterChain);

        assertThat(response.getStatus()).isEqualTo(403);
        verify(filterChain, never()).doFilter(any(), any());
        verify(auditHelper).logHttpEvent(eq(request), eq("tenant_boundary"), eq("enforce"), eq("denied"), eq(403),
                eq("registry lookup failed"), anyMap());
    }
}
