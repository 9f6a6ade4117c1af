package tech.yump.boundary.secrets;

/**
 * Closed set of secret kinds the platform manages. Each type maps to exactly one {@link SecretPolicy}.
 */
public enum SecretType {
    JWT_SECRET,
    DATABASE_CREDENTIAL,
    API_KEY,
    ENCRYPTION_KEY,
    OAUTH_SECRET,
    WEBHOOK_SECRET;

    /**
     * Whether generated values for this type are passwords (mixed character classes) rather than URL-safe tokens.
     */
    public boolean isPasswordLike() {
        return switch (this) {
            case DATABASE_CREDENTIAL -> true;
            case JWT_SECRET, API_KEY, ENCRYPTION_KEY, OAUTH_SECRET, WEBHOOK_SECRET -> false;
        };
    }
}
