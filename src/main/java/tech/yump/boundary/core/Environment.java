package tech.yump.boundary.core;

/**
 * Deployment environment the process runs in. Bound once at startup from {@code boundary.environment}
 * and never changed afterwards; every secrets, CSRF and compliance decision reads it.
 */
public enum Environment {
    DEVELOPMENT,
    TESTING,
    STAGING,
    PRODUCTION;

    public boolean isProduction() {
        return this == PRODUCTION;
    }

    /**
     * Case-insensitive lookup used for the declared {@code ENVIRONMENT} variable, which may be spelled
     * {@code prod}, {@code production}, {@code dev}, etc.
     *
     * @return the matching environment, or {@code null} if the value is blank or unrecognised.
     */
    public static Environment fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        return switch (label.trim().toLowerCase()) {
            case "development", "dev", "local" -> DEVELOPMENT;
            case "testing", "test" -> TESTING;
            case "staging", "stage" -> STAGING;
            case "production", "prod" -> PRODUCTION;
            default -> null;
        };
    }
}
