package tech.yump.boundary.secrets;

import lombok.Getter;
import org.springframework.lang.Nullable;
import tech.yump.boundary.core.Environment;

/**
 * An operation would handle a secret in a way the current environment forbids,
 * such as running production without a hardened store.
 */
@Getter
public class EnvironmentPolicyViolationException extends SecretsPolicyException {

    private final Environment environment;
    @Nullable
    private final SecretType secretType;

    public EnvironmentPolicyViolationException(Environment environment, @Nullable SecretType secretType, String message) {
        super(message + " [environment=" + environment + (secretType != null ? ", secretType=" + secretType : "") + "]");
        this.environment = environment;
        this.secretType = secretType;
    }
}
