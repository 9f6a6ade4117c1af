package tech.yump.boundary.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.secrets.SecretType;
import tech.yump.boundary.secrets.SecretsPolicyEngine;
import tech.yump.boundary.secrets.SecretsPolicyException;
import tech.yump.boundary.web.ServletInboundRequest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * First filter of the boundary chain. Assigns the request id used by audit events and logs, and
 * verifies an HMAC-signed bearer JWT if one is present, exposing its claims under
 * {@link ServletInboundRequest#AUTH_CLAIMS_ATTR}.
 * <p>
 * The verification key is the {@link SecretType#JWT_SECRET} at {@code auth/signing_key}, read through the
 * secrets engine on every request. Tokens that cannot be verified simply contribute no claims; this
 * filter never rejects a request.
 */
@Slf4j
public class AuthTokenClaimsFilter extends OncePerRequestFilter {

    public static final String BEARER_PREFIX = "Bearer ";
    static final String SIGNING_KEY_PATH = "auth";
    static final String SIGNING_KEY_NAME = "signing_key";

    private final SecretsPolicyEngine secretsEngine;
    private final Clock clock;

    public AuthTokenClaimsFilter(SecretsPolicyEngine secretsEngine) {
        this(secretsEngine, Clock.systemUTC());
    }

    AuthTokenClaimsFilter(SecretsPolicyEngine secretsEngine, Clock clock) {
        this.secretsEngine = secretsEngine;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String requestId = UUID.randomUUID().toString();
        request.setAttribute(AuditHelper.REQUEST_ID_ATTR, requestId);
        MDC.put(AuditHelper.MDC_REQUEST_ID_KEY, requestId);
        try {
            resolveClaims(request)
                    .ifPresent(claims -> request.setAttribute(ServletInboundRequest.AUTH_CLAIMS_ATTR, claims));
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(AuditHelper.MDC_REQUEST_ID_KEY);
        }
    }

    Optional<Map<String, Object>> resolveClaims(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
            if (!MACVerifier.SUPPORTED_ALGORITHMS.contains(algorithm)) {
                log.debug("Ignoring bearer token signed with unsupported algorithm {}", algorithm);
                return Optional.empty();
            }

            Optional<String> signingKey = secretsEngine.getSecret(SecretType.JWT_SECRET, SIGNING_KEY_PATH, SIGNING_KEY_NAME, null);
            if (signingKey.isEmpty()) {
                log.warn("Bearer token present but no JWT signing key is available at {}/{}; ignoring token claims.",
                        SIGNING_KEY_PATH, SIGNING_KEY_NAME);
                return Optional.empty();
            }
            if (!jwt.verify(new MACVerifier(signingKey.get().getBytes(StandardCharsets.UTF_8)))) {
                log.warn("Bearer token signature verification failed for {} {}", request.getMethod(), request.getRequestURI());
                return Optional.empty();
            }

            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            Date expiry = claims.getExpirationTime();
            if (expiry != null && !expiry.toInstant().isAfter(clock.instant())) {
                log.debug("Bearer token expired at {}", expiry.toInstant());
                return Optional.empty();
            }
            log.trace("Verified bearer token for subject '{}'", claims.getSubject());
            return Optional.of(claims.getClaims());
        } catch (ParseException | JOSEException e) {
            log.debug("Unusable bearer token: {}", e.getMessage());
            return Optional.empty();
        } catch (SecretsPolicyException e) {
            log.error("Could not read JWT signing key; ignoring bearer token claims: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
