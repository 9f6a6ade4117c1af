package tech.yump.boundary.secrets;

import java.time.Duration;
import java.time.Instant;

/**
 * Handling rules for one {@link SecretType}.
 *
 * @param requiresHardenedStoreInProduction production reads and writes must go through the hardened store.
 * @param allowsLocalFallbackInDev          outside production, reads may fall back to environment variables.
 * @param rotationIntervalDays              maximum age before a value is due for rotation.
 * @param minLength                         minimum accepted value length.
 * @param complexityRequired                values must mix upper case, lower case, digits and symbols.
 * @param generatedLength                   length of values produced by rotation.
 */
public record SecretPolicy(
        boolean requiresHardenedStoreInProduction,
        boolean allowsLocalFallbackInDev,
        int rotationIntervalDays,
        int minLength,
        boolean complexityRequired,
        int generatedLength
) {

    public SecretPolicy {
        if (rotationIntervalDays <= 0) {
            throw new IllegalArgumentException("rotationIntervalDays must be positive");
        }
        if (minLength <= 0) {
            throw new IllegalArgumentException("minLength must be positive");
        }
        if (generatedLength < minLength) {
            throw new IllegalArgumentException("generatedLength (" + generatedLength + ") must not be below minLength (" + minLength + ")");
        }
    }

    public Duration rotationInterval() {
        return Duration.ofDays(rotationIntervalDays);
    }

    public boolean isRotationDue(Instant lastRotated, Instant now) {
        return !lastRotated.plus(rotationInterval()).isAfter(now);
    }

    /**
     * Checks a candidate value against the length and complexity rules.
     *
     * @return null when the value is acceptable, otherwise a description of the first failed rule.
     *         The description never includes the value itself.
     */
    String describeViolation(String value) {
        if (value == null || value.length() < minLength) {
            return "value is shorter than the minimum length of " + minLength;
        }
        if (complexityRequired && !meetsComplexity(value)) {
            return "value must contain upper-case, lower-case, digit and symbol characters";
        }
        return null;
    }

    static boolean meetsComplexity(String value) {
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean symbol = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            } else if (!Character.isWhitespace(c)) {
                symbol = true;
            }
        }
        return upper && lower && digit && symbol;
    }
}
