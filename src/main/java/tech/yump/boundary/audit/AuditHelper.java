package tech.yump.boundary.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link AuditEvent}s from the current security and request context and hands them to the
 * configured {@link AuditBackend}. Failures while auditing are logged and swallowed so they never
 * change the outcome of the audited operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String REQUEST_ID_ATTR = "auditRequestId";
    public static final String MDC_REQUEST_ID_KEY = "requestId";
    public static final String MDC_TENANT_ID_KEY = "tenantId";

    private final AuditBackend auditBackend;
    private Clock clock = Clock.systemUTC();

    /**
     * Logs an event tied to the current HTTP request, if there is one.
     *
     * @param type         The event type (e.g. "tenant_boundary", "csrf").
     * @param action       The specific action (e.g. "enforce", "validate").
     * @param outcome      "success", "failure" or "denied".
     * @param statusCode   HTTP status associated with the outcome.
     * @param errorMessage Optional internal reason; may be more specific than what the client saw.
     * @param data         Optional event-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        logHttpEvent(currentHttpRequest(), type, action, outcome, statusCode, errorMessage, data);
    }

    /**
     * Logs an event for an explicit request; used by servlet filters that run before the request
     * is bound to {@link RequestContextHolder}.
     */
    public void logHttpEvent(
            @Nullable HttpServletRequest request,
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        AuditEvent.AuthInfo authInfo = buildAuthInfo(currentAuthentication(), request);
        AuditEvent.RequestInfo requestInfo = buildRequestInfo(request);
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();
        logEventInternal(type, action, outcome, authInfo, requestInfo, responseInfo, data);
    }

    /**
     * Logs an event from internal processing (secret access, compliance runs). Request context is
     * attached when the call happens on a request thread.
     *
     * @param principal Optional principal; falls back to the security context, then "system".
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {
        Authentication authentication = currentAuthentication();
        String effectivePrincipal = Optional.ofNullable(principal)
                .orElseGet(() -> authentication != null ? authentication.getName() : "system");
        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(effectivePrincipal)
                .build();
        logEventInternal(type, action, outcome, authInfo, buildRequestInfo(currentHttpRequest()), null, data);
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now(clock))
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .tenantId(MDC.get(MDC_TENANT_ID_KEY))
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();
            auditBackend.logEvent(auditEvent);
        } catch (Exception e) {
            log.error("Failed to log audit event: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private Authentication currentAuthentication() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication;
    }

    @Nullable
    private HttpServletRequest currentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    private AuditEvent.AuthInfo buildAuthInfo(@Nullable Authentication authentication, @Nullable HttpServletRequest request) {
        return AuditEvent.AuthInfo.builder()
                .principal(authentication != null ? authentication.getName() : "anonymous")
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown")
                .build();
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
