package tech.yump.boundary.web;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link InboundRequest} over an {@link HttpServletRequest}.
 * <p>
 * Auth claims are read from the {@value #AUTH_CLAIMS_ATTR} request attribute, populated upstream once a
 * bearer token has been verified. Form fields are only read for form content types so that JSON bodies
 * are never consumed.
 */
public class ServletInboundRequest implements InboundRequest {

    public static final String AUTH_CLAIMS_ATTR = "boundary.authClaims";

    private final HttpServletRequest request;

    public ServletInboundRequest(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public String method() {
        return request.getMethod();
    }

    @Override
    public String path() {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (StringUtils.hasLength(contextPath) && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(request.getHeader(name)).filter(StringUtils::hasText);
    }

    @Override
    public Optional<String> cookie(String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> name.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(StringUtils::hasText)
                .findFirst();
    }

    @Override
    public String host() {
        String serverName = request.getServerName();
        return serverName == null ? "" : serverName.toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<String> formField(String name) {
        if (!isFormContent()) {
            return Optional.empty();
        }
        return Optional.ofNullable(request.getParameter(name)).filter(StringUtils::hasText);
    }

    @Override
    public Optional<String> contentType() {
        return Optional.ofNullable(request.getContentType());
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> authClaims() {
        Object claims = request.getAttribute(AUTH_CLAIMS_ATTR);
        return claims instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    public HttpServletRequest servletRequest() {
        return request;
    }

    private boolean isFormContent() {
        String contentType = request.getContentType();
        if (contentType == null) {
            return false;
        }
        try {
            MediaType mediaType = MediaType.parseMediaType(contentType);
            return MediaType.APPLICATION_FORM_URLENCODED.includes(mediaType)
                    || MediaType.MULTIPART_FORM_DATA.includes(mediaType);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
