package tech.yump.boundary.csrf;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import tech.yump.boundary.web.InboundRequest;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a request passes CSRF protection and how a fresh token is delivered.
 * <p>
 * Safe methods always pass and receive a new token. For state-changing API requests the
 * {@value #TOKEN_HEADER} header is authoritative; for server-rendered requests the {@value #FORM_FIELD}
 * form field is (the header is accepted when the form carries none). When the delivery mode sets a cookie,
 * the cookie must match the submitted token byte for byte: server-rendered requests require it, API
 * requests check it whenever it is sent.
 */
@Slf4j
public class CsrfPolicyEngine {

    public static final String TOKEN_HEADER = "X-CSRF-Token";
    public static final String COOKIE_NAME = "csrf_token";
    public static final String FORM_FIELD = "csrf_token";

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

    @Getter
    private final CsrfPolicy policy;
    private final CsrfTokenCodec codec;
    private final Set<String> allowedOrigins;

    public CsrfPolicyEngine(CsrfPolicy policy, CsrfTokenCodec codec) {
        this.policy = policy;
        this.codec = codec;
        this.allowedOrigins = policy.allowedOrigins().stream()
                .map(CsrfPolicyEngine::normalizeOrigin)
                .flatMap(Optional::stream)
                .collect(Collectors.toUnmodifiableSet());

        if (policy.mode() == CsrfMode.DISABLED) {
            log.warn("CSRF protection is DISABLED (boundary.csrf.mode=disabled). State-changing requests will not be checked.");
        } else {
            log.info("CSRF protection enabled: mode={}, delivery={}, refererCheck={}, tokenLifetime={}",
                    policy.mode(), policy.delivery(), policy.requireRefererCheck(), policy.tokenLifetime());
        }
    }

    /**
     * Evaluates a request.
     *
     * @param sessionId session to bind fresh tokens to and to check submitted tokens against; may be null.
     * @param userId    user to bind fresh tokens to and to check submitted tokens against; may be null.
     */
    public CsrfDecision evaluate(InboundRequest request, @Nullable String sessionId, @Nullable String userId) {
        if (policy.mode() == CsrfMode.DISABLED) {
            return CsrfDecision.allow(null, null);
        }
        RequestClass requestClass = classify(request);

        if (isSafeMethod(request.method())) {
            String token = codec.generate(sessionId, userId);
            return CsrfDecision.allow(requestClass, instructionsFor(token));
        }

        Optional<CsrfFailure> failure = requestClass == RequestClass.API
                ? checkApiRequest(request, sessionId, userId)
                : checkSsrRequest(request, sessionId, userId);
        if (failure.isEmpty() && policy.requireRefererCheck()) {
            failure = checkReferer(request);
        }

        if (failure.isPresent()) {
            log.warn("CSRF check failed for {} {} ({}): {}", request.method(), request.path(), requestClass, failure.get());
            return CsrfDecision.reject(requestClass, failure.get());
        }
        log.trace("CSRF check passed for {} {} ({})", request.method(), request.path(), requestClass);
        return CsrfDecision.allow(requestClass, null);
    }

    public RequestClass classify(InboundRequest request) {
        return switch (policy.mode()) {
            case API_ONLY -> RequestClass.API;
            case SSR_ONLY -> RequestClass.SSR;
            case HYBRID, DISABLED -> classifyHybrid(request);
        };
    }

    public static boolean isSafeMethod(String method) {
        return method != null && SAFE_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    private RequestClass classifyHybrid(InboundRequest request) {
        String path = request.path();
        if (policy.apiPathPrefixes().stream().anyMatch(path::startsWith)) {
            return RequestClass.API;
        }
        if (policy.ssrPathPrefixes().stream().anyMatch(path::startsWith) || isFormContent(request)) {
            return RequestClass.SSR;
        }
        return RequestClass.API;
    }

    private Optional<CsrfFailure> checkApiRequest(InboundRequest request, @Nullable String sessionId, @Nullable String userId) {
        Optional<String> token = request.header(TOKEN_HEADER);
        if (token.isEmpty()) {
            return Optional.of(CsrfFailure.NO_TOKEN_PRESENT);
        }
        Optional<CsrfFailure> tokenFailure = verifyToken(token.get(), sessionId, userId);
        if (tokenFailure.isPresent()) {
            return tokenFailure;
        }
        if (policy.delivery().usesCookie()) {
            Optional<String> cookie = request.cookie(COOKIE_NAME);
            if (cookie.isPresent() && !sameBytes(cookie.get(), token.get())) {
                return Optional.of(CsrfFailure.DOUBLE_SUBMIT_MISMATCH);
            }
        }
        return Optional.empty();
    }

    private Optional<CsrfFailure> checkSsrRequest(InboundRequest request, @Nullable String sessionId, @Nullable String userId) {
        Optional<String> token = request.formField(FORM_FIELD).or(() -> request.header(TOKEN_HEADER));
        if (token.isEmpty()) {
            return Optional.of(CsrfFailure.NO_TOKEN_PRESENT);
        }
        Optional<CsrfFailure> tokenFailure = verifyToken(token.get(), sessionId, userId);
        if (tokenFailure.isPresent()) {
            return tokenFailure;
        }
        if (policy.delivery().usesCookie()) {
            Optional<String> cookie = request.cookie(COOKIE_NAME);
            if (cookie.isEmpty() || !sameBytes(cookie.get(), token.get())) {
                return Optional.of(CsrfFailure.DOUBLE_SUBMIT_MISMATCH);
            }
        }
        return Optional.empty();
    }

    private Optional<CsrfFailure> verifyToken(String token, @Nullable String sessionId, @Nullable String userId) {
        return switch (codec.verify(token, sessionId, userId)) {
            case VALID -> Optional.empty();
            case EXPIRED -> Optional.of(CsrfFailure.TOKEN_EXPIRED);
            case BINDING_MISMATCH -> Optional.of(CsrfFailure.BINDING_MISMATCH);
            case MALFORMED, SIGNATURE_INVALID -> Optional.of(CsrfFailure.SIGNATURE_INVALID);
        };
    }

    private Optional<CsrfFailure> checkReferer(InboundRequest request) {
        Optional<String> source = request.header("Origin").or(() -> request.header("Referer"));
        if (source.isEmpty()) {
            return Optional.of(CsrfFailure.REFERER_REJECTED);
        }
        URI uri;
        try {
            uri = new URI(source.get().trim());
        } catch (URISyntaxException e) {
            return Optional.of(CsrfFailure.REFERER_REJECTED);
        }
        if (uri.getHost() == null) {
            return Optional.of(CsrfFailure.REFERER_REJECTED);
        }
        if (uri.getHost().equalsIgnoreCase(request.host())) {
            return Optional.empty();
        }
        boolean allowed = normalizeOrigin(source.get()).map(allowedOrigins::contains).orElse(false);
        return allowed ? Optional.empty() : Optional.of(CsrfFailure.REFERER_REJECTED);
    }

    private CsrfResponseInstructions instructionsFor(String token) {
        TokenDelivery delivery = policy.delivery();
        Map<String, String> headers = delivery.usesHeader() ? Map.of(TOKEN_HEADER, token) : Map.of();
        CsrfCookie cookie = delivery.usesCookie()
                ? new CsrfCookie(COOKIE_NAME, token, policy.cookie(), policy.tokenLifetime())
                : null;
        String metaTag = delivery == TokenDelivery.META_TAG ? token : null;
        return new CsrfResponseInstructions(headers, cookie, metaTag);
    }

    private static boolean isFormContent(InboundRequest request) {
        return request.contentType().map(value -> {
            try {
                MediaType mediaType = MediaType.parseMediaType(value);
                return MediaType.APPLICATION_FORM_URLENCODED.includes(mediaType)
                        || MediaType.MULTIPART_FORM_DATA.includes(mediaType);
            } catch (IllegalArgumentException e) {
                return false;
            }
        }).orElse(false);
    }

    private static boolean sameBytes(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    static Optional<String> normalizeOrigin(String value) {
        try {
            URI uri = new URI(value.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return Optional.empty();
            }
            String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getHost().toLowerCase(Locale.ROOT);
            return Optional.of(uri.getPort() >= 0 ? origin + ":" + uri.getPort() : origin);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
