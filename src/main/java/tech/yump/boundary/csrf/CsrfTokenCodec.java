package tech.yump.boundary.csrf;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Issues and checks stateless, HMAC-signed CSRF tokens.
 * <p>
 * A token is {@code base64url(payload) "." base64url(HMAC-SHA256(payload))}, where the payload is
 * {@code {issuedAtEpochSeconds}:{nonce}}, optionally followed by {@code :session:{sessionId}} and
 * {@code :user:{userId}}, with binding values form-encoded. No server-side state is kept; the signing key is
 * shared by the whole process.
 * A token is valid while {@code now - issuedAt < lifetime}.
 */
@Slf4j
public class CsrfTokenCodec {

    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(1);
    static final Duration ALLOWED_CLOCK_SKEW = Duration.ofSeconds(30);

    private static final String SESSION_LABEL = "session";
    private static final String USER_LABEL = "user";
    static final String SESSION_MARKER = ":" + SESSION_LABEL + ":";
    static final String USER_MARKER = ":" + USER_LABEL + ":";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int NONCE_BYTES = 16;
    private static final int MIN_KEY_BYTES = 32;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec signingKey;
    private final long lifetimeSeconds;
    private final Clock clock;
    private final SecureRandom random;

    public CsrfTokenCodec(byte[] signingKey, Duration lifetime) {
        this(signingKey, lifetime, Clock.systemUTC(), new SecureRandom());
    }

    CsrfTokenCodec(byte[] signingKey, Duration lifetime, Clock clock, SecureRandom random) {
        if (signingKey == null || signingKey.length < MIN_KEY_BYTES) {
            throw new IllegalArgumentException("CSRF signing key must be at least " + MIN_KEY_BYTES + " bytes");
        }
        if (lifetime == null || lifetime.getSeconds() <= 0) {
            throw new IllegalArgumentException("CSRF token lifetime must be at least one second");
        }
        this.signingKey = new SecretKeySpec(signingKey.clone(), HMAC_ALGORITHM);
        this.lifetimeSeconds = lifetime.getSeconds();
        this.clock = clock;
        this.random = random;
    }

    public Duration lifetime() {
        return Duration.ofSeconds(lifetimeSeconds);
    }

    /**
     * Issues a new token, optionally bound to a session and/or user.
     */
    public String generate(@Nullable String sessionId, @Nullable String userId) {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        StringBuilder payload = new StringBuilder()
                .append(clock.instant().getEpochSecond())
                .append(':')
                .append(ENCODER.encodeToString(nonce));
        if (sessionId != null) {
            payload.append(SESSION_MARKER).append(encodeBinding(sessionId));
        }
        if (userId != null) {
            payload.append(USER_MARKER).append(encodeBinding(userId));
        }
        byte[] payloadBytes = payload.toString().getBytes(StandardCharsets.UTF_8);
        return ENCODER.encodeToString(payloadBytes) + "." + ENCODER.encodeToString(sign(payloadBytes));
    }

    public boolean validate(@Nullable String token, @Nullable String sessionId, @Nullable String userId) {
        return verify(token, sessionId, userId) == CsrfValidationOutcome.VALID;
    }

    /**
     * Checks structure, signature, age and bindings. Every check is evaluated; the reported outcome is
     * the first failure in that order.
     * <p>
     * Both segments are compared in their canonical unpadded base64url form, so a segment that decodes to
     * the right bytes but differs in its unused trailing bits does not verify.
     */
    public CsrfValidationOutcome verify(@Nullable String token, @Nullable String sessionId, @Nullable String userId) {
        if (token == null || token.isEmpty()) {
            return CsrfValidationOutcome.MALFORMED;
        }
        String[] segments = token.split("\\.", -1);
        if (segments.length != 2 || segments[0].isEmpty() || segments[1].isEmpty()) {
            return CsrfValidationOutcome.MALFORMED;
        }

        byte[] payloadBytes;
        Payload payload;
        try {
            payloadBytes = DECODER.decode(segments[0]);
            DECODER.decode(segments[1]);
            payload = Payload.parse(new String(payloadBytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.debug("Malformed CSRF token: {}", e.getMessage());
            return CsrfValidationOutcome.MALFORMED;
        }

        boolean payloadCanonical = ENCODER.encodeToString(payloadBytes).equals(segments[0]);
        byte[] expectedSignature = ENCODER.encodeToString(sign(payloadBytes)).getBytes(StandardCharsets.US_ASCII);
        boolean signatureValid = MessageDigest.isEqual(expectedSignature, segments[1].getBytes(StandardCharsets.US_ASCII))
                && payloadCanonical;
        long age = clock.instant().getEpochSecond() - payload.issuedAt();
        boolean fresh = age < lifetimeSeconds && age >= -ALLOWED_CLOCK_SKEW.getSeconds();
        boolean sessionBound = sessionId == null || encodeBinding(sessionId).equals(payload.sessionId());
        boolean userBound = userId == null || encodeBinding(userId).equals(payload.userId());

        if (!signatureValid) {
            return CsrfValidationOutcome.SIGNATURE_INVALID;
        }
        if (!fresh) {
            return CsrfValidationOutcome.EXPIRED;
        }
        if (!sessionBound || !userBound) {
            return CsrfValidationOutcome.BINDING_MISMATCH;
        }
        return CsrfValidationOutcome.VALID;
    }

    // Binding values are form-encoded so that ':' can only appear as a delimiter.
    private static String encodeBinding(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Positional view of {@code {issuedAt}:{nonce}[:session:{sessionId}][:user:{userId}]}; binding values
     * are kept in their encoded form.
     */
    private record Payload(long issuedAt, @Nullable String sessionId, @Nullable String userId) {

        static Payload parse(String payload) {
            String[] parts = payload.split(":", -1);
            if (parts.length < 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
                throw new IllegalArgumentException("payload lacks timestamp or nonce");
            }
            long issuedAt = Long.parseLong(parts[0]);
            String sessionId = null;
            String userId = null;
            int i = 2;
            if (i + 1 < parts.length && SESSION_LABEL.equals(parts[i])) {
                sessionId = parts[i + 1];
                i += 2;
            }
            if (i + 1 < parts.length && USER_LABEL.equals(parts[i])) {
                userId = parts[i + 1];
                i += 2;
            }
            if (i != parts.length) {
                throw new IllegalArgumentException("unexpected payload segments");
            }
            return new Payload(issuedAt, sessionId, userId);
        }
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
