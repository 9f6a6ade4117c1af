package tech.yump.boundary.secrets;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Produces fresh secret values from a {@link SecureRandom}.
 */
public class SecretValueGenerator {

    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    static final String DIGITS = "0123456789";
    static final String SYMBOLS = "!#%+-.:=?@^_~";
    private static final String ALL = UPPER + LOWER + DIGITS + SYMBOLS;

    private final SecureRandom random;

    public SecretValueGenerator() {
        this(new SecureRandom());
    }

    public SecretValueGenerator(SecureRandom random) {
        this.random = random;
    }

    /**
     * Generates a value shaped for the given type: passwords for password-like types, URL-safe tokens otherwise.
     */
    public String generate(SecretType type, SecretPolicy policy) {
        int length = policy.generatedLength();
        return type.isPasswordLike() || policy.complexityRequired() ? password(length) : urlSafeToken(length);
    }

    /**
     * URL-safe Base64 (no padding) text of exactly {@code length} characters.
     */
    public String urlSafeToken(int length) {
        byte[] bytes = new byte[(length * 3 + 3) / 4];
        random.nextBytes(bytes);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return encoded.substring(0, length);
    }

    /**
     * Password of {@code length} characters containing at least one upper-case letter, lower-case letter,
     * digit and symbol.
     */
    public String password(int length) {
        if (length < 4) {
            throw new IllegalArgumentException("Password length must be at least 4");
        }
        List<Character> chars = new ArrayList<>(length);
        chars.add(pick(UPPER));
        chars.add(pick(LOWER));
        chars.add(pick(DIGITS));
        chars.add(pick(SYMBOLS));
        while (chars.size() < length) {
            chars.add(pick(ALL));
        }
        Collections.shuffle(chars, random);
        StringBuilder sb = new StringBuilder(length);
        chars.forEach(sb::append);
        return sb.toString();
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }
}
