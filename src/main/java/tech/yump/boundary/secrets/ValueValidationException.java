package tech.yump.boundary.secrets;

import lombok.Getter;

/**
 * A secret value was rejected by its type's length or complexity rules. Never carries the value.
 */
@Getter
public class ValueValidationException extends SecretsPolicyException {

    private final SecretType secretType;

    public ValueValidationException(SecretType secretType, String message) {
        super("Invalid value for " + secretType + ": " + message);
        this.secretType = secretType;
    }
}
