package tech.yump.boundary.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import tech.yump.boundary.config.BoundaryProperties;
import tech.yump.boundary.csrf.TokenDelivery;

import java.time.Duration;

/**
 * Cross-field rules for {@link BoundaryProperties.CsrfProperties}:
 * SameSite=None needs a Secure cookie, cookie-only delivery needs a script-readable cookie,
 * and the token lifetime must lie in [1s, 24h].
 */
public class CsrfConfigValidator implements ConstraintValidator<ValidCsrfConfig, BoundaryProperties.CsrfProperties> {

    static final Duration MIN_TOKEN_LIFETIME = Duration.ofSeconds(1);
    static final Duration MAX_TOKEN_LIFETIME = Duration.ofHours(24);

    @Override
    public boolean isValid(BoundaryProperties.CsrfProperties value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        boolean valid = true;
        context.disableDefaultConstraintViolation();

        if ("None".equalsIgnoreCase(value.cookie().sameSite()) && !value.cookie().secure()) {
            context.buildConstraintViolationWithTemplate("CSRF cookie with SameSite=None must be Secure (boundary.csrf.cookie.secure).")
                    .addConstraintViolation();
            valid = false;
        }
        // The client must read the cookie to echo it back in a header.
        if (value.delivery() == TokenDelivery.COOKIE_ONLY && value.cookie().httpOnly()) {
            context.buildConstraintViolationWithTemplate("CSRF cookie cannot be HttpOnly when delivery is COOKIE_ONLY (boundary.csrf.cookie.http-only).")
                    .addConstraintViolation();
            valid = false;
        }
        Duration lifetime = value.tokenLifetime();
        if (lifetime.compareTo(MIN_TOKEN_LIFETIME) < 0 || lifetime.compareTo(MAX_TOKEN_LIFETIME) > 0) {
            context.buildConstraintViolationWithTemplate("CSRF token lifetime (boundary.csrf.token-lifetime) must be between 1s and 24h.")
                    .addConstraintViolation();
            valid = false;
        }
        return valid;
    }
}
