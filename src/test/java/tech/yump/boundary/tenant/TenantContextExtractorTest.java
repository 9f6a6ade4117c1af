package tech.yump.boundary.tenant;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import tech.yump.boundary.web.ServletInboundRequest;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TenantContextExtractorTest {

    private final TenantContextExtractor extractor = TenantContextExtractor.withDefaults("boundary.test");

    private static MockHttpServletRequest request() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/tenant");
        request.setServerName("localhost");
        return request;
    }

    @Test
    void extractAll_shouldReturnCandidatesInPriorityOrder() {
        MockHttpServletRequest request = request();
        request.setServerName("acme.boundary.test");
        request.addHeader(TenantContextExtractor.DEFAULT_CONTAINER_HEADER, "acme");
        request.addHeader(TenantContextExtractor.DEFAULT_GATEWAY_HEADER, "acme");
        request.setAttribute(ServletInboundRequest.AUTH_CLAIMS_ATTR, Map.of("tenant_id", "acme"));

        assertThat(extractor.extractAll(new ServletInboundRequest(request)))
                .extracting(TenantContext::source)
                .containsExactly(TenantSource.GATEWAY_HEADER, TenantSource.CONTAINER_CONTEXT,
                        TenantSource.AUTH_TOKEN, TenantSource.SUBDOMAIN);
    }

    @Test
    void candidates_shouldNotBeValidated() {
        MockHttpServletRequest request = request();
        request.addHeader(TenantContextExtractor.DEFAULT_GATEWAY_HEADER, " acme ");

        TenantContext context = extractor.fromGatewayHeader(new ServletInboundRequest(request)).orElseThrow();

        assertThat(context.tenantId()).isEqualTo("acme");
        assertThat(context.validated()).isFalse();
    }

    @Test
    void malformedIds_shouldBeIgnored() {
        MockHttpServletRequest request = request();
        request.addHeader(TenantContextExtractor.DEFAULT_GATEWAY_HEADER, "ACME; DROP TABLE");
        request.addHeader(TenantContextExtractor.DEFAULT_CONTAINER_HEADER, "../acme");

        assertThat(extractor.extractAll(new ServletInboundRequest(request))).isEmpty();
    }

    @Test
    void fromAuthToken_shouldAcceptUuidAndIgnoreNonStringClaims() {
        MockHttpServletRequest request = request();
        request.setAttribute(ServletInboundRequest.AUTH_CLAIMS_ATTR,
                Map.of("tenant_id", "3f2504e0-4f89-11d3-9a0c-0305e82c3301"));
        assertThat(extractor.fromAuthToken(new ServletInboundRequest(request)))
                .map(TenantContext::tenantId)
                .contains("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

        MockHttpServletRequest numeric = request();
        numeric.setAttribute(ServletInboundRequest.AUTH_CLAIMS_ATTR, Map.of("tenant_id", 42));
        assertThat(extractor.fromAuthToken(new ServletInboundRequest(numeric))).isEmpty();
    }

    @Test
    void fromSubdomain_shouldIgnoreReservedNestedAndForeignHosts() {
        for (String host : new String[]{"www.boundary.test", "a.b.boundary.test", "boundary.test", "acme.other.test"}) {
            MockHttpServletRequest request = request();
            request.setServerName(host);
            assertThat(extractor.fromSubdomain(new ServletInboundRequest(request))).as(host).isEmpty();
        }
    }

    @Test
    void fromSubdomain_withoutBaseDomain_shouldBeDisabled() {
        MockHttpServletRequest request = request();
        request.setServerName("acme.boundary.test");

        assertThat(TenantContextExtractor.withDefaults(null).fromSubdomain(new ServletInboundRequest(request))).isEmpty();
    }
}
