package tech.yump.boundary.secrets;

/**
 * The hardened store could not serve a request where failing open is not allowed.
 */
public class StoreUnavailableException extends SecretsPolicyException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
