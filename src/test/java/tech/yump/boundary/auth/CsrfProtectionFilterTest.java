package tech.yump.boundary.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.csrf.CookieAttributes;
import tech.yump.boundary.csrf.CsrfCookie;
import tech.yump.boundary.csrf.CsrfMode;
import tech.yump.boundary.csrf.CsrfPolicy;
import tech.yump.boundary.csrf.CsrfPolicyEngine;
import tech.yump.boundary.csrf.CsrfTokenCodec;
import tech.yump.boundary.csrf.TokenDelivery;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CsrfProtectionFilterTest {

    private static final byte[] KEY = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);

    @Mock
    private AuditHelper auditHelper;
    @Mock
    private FilterChain filterChain;

    private final CsrfTokenCodec codec = new CsrfTokenCodec(KEY, Duration.ofMinutes(30));
    private CsrfProtectionFilter filter;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = filter(CsrfMode.HYBRID, TokenDelivery.BOTH);
        response = new MockHttpServletResponse();
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    private CsrfProtectionFilter filter(CsrfMode mode, TokenDelivery delivery) {
        CsrfPolicy policy = new CsrfPolicy(mode, delivery, false, List.of(), CookieAttributes.defaults(),
                Duration.ofMinutes(30), List.of("/api/"), List.of("/portal/"));
        return new CsrfProtectionFilter(new CsrfPolicyEngine(policy, codec), auditHelper, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void doFilterInternal_onSafeRequest_shouldDeliverTokenInHeaderAndCookie() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/tenant");

        filter.doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        String token = response.getHeader(CsrfPolicyEngine.TOKEN_HEADER);
        assertThat(token).isNotBlank();
        assertThat(codec.validate(token, null, null)).isTrue();
        assertThat(response.getHeader(HttpHeaders.SET_COOKIE))
                .startsWith(CsrfPolicyEngine.COOKIE_NAME + "=" + token)
                .contains("Secure")
                .contains("SameSite=Strict")
                .doesNotContain("HttpOnly");
        verifyNoInteractions(auditHelper);
    }

    @Test
    void doFilterInternal_withSessionAndUser_shouldBindIssuedToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/tenant");
        MockHttpSession session = new MockHttpSession(null, "sess-42");
        request.setSession(session);
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("alice", "n/a", AuthorityUtils.NO_AUTHORITIES));

        filter.doFilterInternal(request, response, filterChain);

        String token = response.getHeader(CsrfPolicyEngine.TOKEN_HEADER);
        assertThat(codec.validate(token, "sess-42", "alice")).isTrue();
        assertThat(codec.validate(token, "sess-43", "alice")).isFalse();
    }

    @Test
    void doFilterInternal_onPostWithoutToken_shouldRejectWithGenericForbidden() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/tenant/verify");

        filter.doFilterInternal(request, response, filterChain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("Access denied.").doesNotContain("NO_TOKEN_PRESENT");
        verify(filterChain, never()).doFilter(any(), any());
        verify(auditHelper).logHttpEvent(eq(request), eq("csrf"), eq("validate"), eq("denied"), eq(403), anyString(),
                eq(Map.of("failure", "NO_TOKEN_PRESENT", "request_class", "API")));
    }

    @Test
    void doFilterInternal_onPostWithValidHeaderToken_shouldContinue() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/tenant/verify");
        request.addHeader(CsrfPolicyEngine.TOKEN_HEADER, codec.generate(null, null));

        filter.doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        assertThat(response.getHeader(CsrfPolicyEngine.TOKEN_HEADER)).isNull();
    }

    @Test
    void doFilterInternal_onSsrFormWithoutCookie_shouldReject() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/portal/settings");
        request.setContentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
        request.addParameter(CsrfPolicyEngine.FORM_FIELD, codec.generate(null, null));

        filter.doFilterInternal(request, response, filterChain);

        assertThat(response.getStatus()).isEqualTo(403);
        verify(auditHelper).logHttpEvent(eq(request), eq("csrf"), eq("validate"), eq("denied"), eq(403), anyString(),
                eq(Map.of("failure", "DOUBLE_SUBMIT_MISMATCH", "request_class", "SSR")));
    }

    @Test
    void doFilterInternal_onSsrFormWithMatchingCookie_shouldContinue() throws Exception {
        String token = codec.generate(null, null);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/portal/settings");
        request.setContentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
        request.addParameter(CsrfPolicyEngine.FORM_FIELD, token);
        request.setCookies(new Cookie(CsrfPolicyEngine.COOKIE_NAME, token));

        filter.doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
    }

    @Test
    void doFilterInternal_withMetaTagDelivery_shouldExposeTokenAsRequestAttribute() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/portal/home");

        filter(CsrfMode.SSR_ONLY, TokenDelivery.META_TAG).doFilterInternal(request, response, filterChain);

        assertThat(request.getAttribute(CsrfProtectionFilter.META_TOKEN_ATTR)).isInstanceOf(String.class);
        assertThat(response.getHeader(HttpHeaders.SET_COOKIE)).isNull();
    }

    @Test
    void doFilterInternal_whenDisabled_shouldNeverReject() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/v1/tenant");

        filter(CsrfMode.DISABLED, TokenDelivery.BOTH).doFilterInternal(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        verifyNoInteractions(auditHelper);
    }

    @Test
    void toSetCookie_shouldRenderConfiguredAttributes() {
        CsrfCookie cookie = new CsrfCookie("csrf_token", "abc", new CookieAttributes(false, false, "Lax", "/portal"),
                Duration.ofMinutes(10));

        assertThat(CsrfProtectionFilter.toSetCookie(cookie))
                .startsWith("csrf_token=abc; Path=/portal; Max-Age=600")
                .contains("SameSite=Lax")
                .doesNotContain("Secure")
                .doesNotContain("HttpOnly");
    }
}
