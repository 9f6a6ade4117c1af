package tech.yump.boundary.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.csrf.CookieAttributes;
import tech.yump.boundary.csrf.CsrfCookie;
import tech.yump.boundary.csrf.CsrfDecision;
import tech.yump.boundary.csrf.CsrfPolicyEngine;
import tech.yump.boundary.csrf.CsrfResponseInstructions;
import tech.yump.boundary.web.ServletInboundRequest;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Applies {@link CsrfPolicyEngine} decisions to servlet requests: rejects failing state-changing
 * requests with a generic 403 and writes fresh tokens to the response as instructed. Tokens are bound to
 * the HTTP session id and the authenticated user name when those exist.
 */
@Slf4j
@RequiredArgsConstructor
public class CsrfProtectionFilter extends OncePerRequestFilter {

    public static final String META_TOKEN_ATTR = "boundary.csrfMetaToken";
    private static final String AUDIT_TYPE = "csrf";

    private final CsrfPolicyEngine engine;
    private final AuditHelper auditHelper;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String sessionId = Optional.ofNullable(request.getSession(false)).map(HttpSession::getId).orElse(null);
        CsrfDecision decision = engine.evaluate(new ServletInboundRequest(request), sessionId, currentUser());

        if (!decision.allowed()) {
            auditHelper.logHttpEvent(request, AUDIT_TYPE, "validate", "denied", HttpStatus.FORBIDDEN.value(),
                    "CSRF check failed: " + decision.failure(),
                    Map.of("failure", String.valueOf(decision.failure()), "request_class", String.valueOf(decision.requestClass())));
            ForbiddenResponses.write(response, objectMapper);
            return;
        }

        decision.responseInstructions().ifPresent(instructions -> apply(instructions, request, response));
        filterChain.doFilter(request, response);
    }

    private void apply(CsrfResponseInstructions instructions, HttpServletRequest request, HttpServletResponse response) {
        instructions.headers().forEach(response::setHeader);
        instructions.cookieToSet().ifPresent(cookie -> response.addHeader(HttpHeaders.SET_COOKIE, toSetCookie(cookie)));
        instructions.metaTag().ifPresent(token -> request.setAttribute(META_TOKEN_ATTR, token));
    }

    static String toSetCookie(CsrfCookie cookie) {
        CookieAttributes attributes = cookie.attributes();
        return ResponseCookie.from(cookie.name(), cookie.value())
                .secure(attributes.secure())
                .httpOnly(attributes.httpOnly())
                .sameSite(attributes.sameSite())
                .path(attributes.path())
                .maxAge(cookie.maxAge())
                .build()
                .toString();
    }

    @Nullable
    private String currentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication.getName();
    }
}
