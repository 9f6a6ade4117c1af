package tech.yump.boundary.secrets;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from {@link SecretType} to {@link SecretPolicy}, built once at startup.
 */
@Slf4j
public final class SecretPolicyTable {

    private final Map<SecretType, SecretPolicy> policies;

    private SecretPolicyTable(Map<SecretType, SecretPolicy> policies) {
        this.policies = Collections.unmodifiableMap(new EnumMap<>(policies));
    }

    /**
     * The built-in policies covering every secret type.
     */
    public static SecretPolicyTable defaults() {
        return new SecretPolicyTable(defaultPolicies());
    }

    /**
     * Built-in policies with the given per-type replacements applied.
     */
    public static SecretPolicyTable withOverrides(Map<SecretType, SecretPolicy> overrides) {
        EnumMap<SecretType, SecretPolicy> merged = defaultPolicies();
        if (overrides != null) {
            overrides.forEach((type, policy) -> {
                log.info("Overriding default secret policy for {}: {}", type, policy);
                merged.put(type, policy);
            });
        }
        return new SecretPolicyTable(merged);
    }

    /**
     * A table holding exactly the given policies. Types not present have no policy.
     */
    public static SecretPolicyTable of(Map<SecretType, SecretPolicy> policies) {
        return new SecretPolicyTable(policies.isEmpty() ? new EnumMap<>(SecretType.class) : new EnumMap<>(policies));
    }

    public Optional<SecretPolicy> policyFor(SecretType type) {
        return Optional.ofNullable(policies.get(type));
    }

    public Map<SecretType, SecretPolicy> asMap() {
        return policies;
    }

    private static EnumMap<SecretType, SecretPolicy> defaultPolicies() {
        EnumMap<SecretType, SecretPolicy> defaults = new EnumMap<>(SecretType.class);
        for (SecretType type : SecretType.values()) {
            defaults.put(type, switch (type) {
                case JWT_SECRET -> new SecretPolicy(true, true, 90, 32, false, 64);
                case DATABASE_CREDENTIAL -> new SecretPolicy(true, true, 30, 16, true, 32);
                case API_KEY -> new SecretPolicy(true, true, 180, 32, false, 48);
                case ENCRYPTION_KEY -> new SecretPolicy(true, false, 365, 32, false, 64);
                case OAUTH_SECRET -> new SecretPolicy(true, true, 90, 24, false, 48);
                case WEBHOOK_SECRET -> new SecretPolicy(true, true, 90, 24, false, 48);
            });
        }
        return defaults;
    }
}
