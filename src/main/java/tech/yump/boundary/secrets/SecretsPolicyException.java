package tech.yump.boundary.secrets;

/**
 * Base class for failures raised by {@link SecretsPolicyEngine}.
 */
public class SecretsPolicyException extends RuntimeException {

    public SecretsPolicyException(String message) {
        super(message);
    }

    public SecretsPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
