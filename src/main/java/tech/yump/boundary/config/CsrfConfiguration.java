package tech.yump.boundary.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.boundary.core.Environment;
import tech.yump.boundary.csrf.CsrfPolicy;
import tech.yump.boundary.csrf.CsrfPolicyEngine;
import tech.yump.boundary.csrf.CsrfTokenCodec;
import tech.yump.boundary.secrets.EnvironmentPolicyViolationException;
import tech.yump.boundary.secrets.SecretType;
import tech.yump.boundary.secrets.SecretsPolicyEngine;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Optional;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class CsrfConfiguration {

    static final String SIGNING_KEY_PATH = "csrf";
    static final String SIGNING_KEY_NAME = "signing_key";
    private static final int EPHEMERAL_KEY_BYTES = 32;

    private final BoundaryProperties properties;

    @Bean
    public CsrfPolicy csrfPolicy() {
        return properties.csrf().toPolicy();
    }

    @Bean
    public CsrfTokenCodec csrfTokenCodec(SecretsPolicyEngine secretsEngine, CsrfPolicy csrfPolicy) {
        return new CsrfTokenCodec(resolveSigningKey(secretsEngine, csrfPolicy), csrfPolicy.tokenLifetime());
    }

    @Bean
    public CsrfPolicyEngine csrfPolicyEngine(CsrfPolicy csrfPolicy, CsrfTokenCodec csrfTokenCodec) {
        log.info("CSRF protection mode {} with {} token delivery.", csrfPolicy.mode(), csrfPolicy.delivery());
        return new CsrfPolicyEngine(csrfPolicy, csrfTokenCodec);
    }

    byte[] resolveSigningKey(SecretsPolicyEngine secretsEngine, CsrfPolicy csrfPolicy) {
        Optional<String> stored = secretsEngine.getSecret(SecretType.ENCRYPTION_KEY, SIGNING_KEY_PATH, SIGNING_KEY_NAME, null);
        if (stored.isPresent()) {
            return stored.get().getBytes(StandardCharsets.UTF_8);
        }
        Environment environment = properties.environment();
        if (environment.isProduction() && csrfPolicy.isEnabled()) {
            throw new EnvironmentPolicyViolationException(environment, SecretType.ENCRYPTION_KEY,
                    "CSRF signing key not found at " + SIGNING_KEY_PATH + "/" + SIGNING_KEY_NAME);
        }
        log.warn("No CSRF signing key stored at {}/{}; using an ephemeral key. Tokens will not survive a restart "
                + "or validate across instances.", SIGNING_KEY_PATH, SIGNING_KEY_NAME);
        byte[] key = new byte[EPHEMERAL_KEY_BYTES];
        new SecureRandom().nextBytes(key);
        return key;
    }
}
