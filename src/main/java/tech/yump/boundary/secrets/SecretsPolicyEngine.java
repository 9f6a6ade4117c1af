package tech.yump.boundary.secrets;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.core.Environment;
import tech.yump.boundary.storage.LocalFallbackStore;
import tech.yump.boundary.storage.SecretStore;
import tech.yump.boundary.storage.StorageException;
import tech.yump.boundary.storage.StoreHealth;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for reading, writing and rotating secrets under environment-specific rules.
 * <p>
 * In {@link Environment#PRODUCTION} a hardened store is mandatory, every read and write goes through it,
 * and its failures are fatal. Outside production a read-only {@link LocalFallbackStore} is wired as well;
 * reads may fall back to it when the type's policy allows, and every such read is logged at WARN.
 * Writes only ever go to the hardened store.
 * <p>
 * Instances are immutable and hold no cached secret values, so they are safe for concurrent use.
 */
@Slf4j
public class SecretsPolicyEngine {

    private static final String AUDIT_TYPE = "secrets";

    @Getter
    private final Environment environment;
    @Nullable
    private final SecretStore hardenedStore;
    @Nullable
    private final SecretStore fallbackStore;
    @Getter
    private final SecretPolicyTable policyTable;
    private final Duration storeTimeout;
    private final SecretValueGenerator valueGenerator;
    private final AuditHelper auditHelper;
    private final Clock clock;

    /**
     * Creates the engine, failing fast when production has no hardened store.
     *
     * @param hardenedStore       the hardened store, or null when none is configured.
     * @param fallbackEnvironment variables backing the fallback store outside production; ignored in production.
     * @throws EnvironmentPolicyViolationException in production without a hardened store.
     */
    public SecretsPolicyEngine(
            Environment environment,
            @Nullable SecretStore hardenedStore,
            SecretPolicyTable policyTable,
            Map<String, String> fallbackEnvironment,
            Duration storeTimeout,
            AuditHelper auditHelper) {
        this(environment, hardenedStore,
                environment.isProduction() ? null : new LocalFallbackStore(fallbackEnvironment),
                policyTable, storeTimeout, new SecretValueGenerator(), auditHelper, Clock.systemUTC());
    }

    /**
     * Full constructor. The fallback store is taken as given, so a caller can wire one even in production;
     * {@link #validateEnvironmentCompliance()} reports that as a violation.
     */
    SecretsPolicyEngine(
            Environment environment,
            @Nullable SecretStore hardenedStore,
            @Nullable SecretStore fallbackStore,
            SecretPolicyTable policyTable,
            Duration storeTimeout,
            SecretValueGenerator valueGenerator,
            AuditHelper auditHelper,
            Clock clock) {
        if (environment.isProduction() && hardenedStore == null) {
            log.error("Refusing to start: no hardened secret store configured in {}", environment);
            throw new EnvironmentPolicyViolationException(environment, null,
                    "A hardened secret store is required in production");
        }
        this.environment = environment;
        this.hardenedStore = hardenedStore;
        this.fallbackStore = fallbackStore;
        this.policyTable = policyTable;
        this.storeTimeout = storeTimeout;
        this.valueGenerator = valueGenerator;
        this.auditHelper = auditHelper;
        this.clock = clock;

        if (hardenedStore == null) {
            log.warn("SecretsPolicyEngine running in {} without a hardened store. Secrets can only be read from "
                    + "environment variables and writes will be refused.", environment);
        }
        if (fallbackStore != null) {
            log.info("SecretsPolicyEngine initialized for {} with environment-variable fallback enabled.", environment);
        } else {
            log.info("SecretsPolicyEngine initialized for {} (hardened store only).", environment);
        }
    }

    /**
     * Reads a secret.
     *
     * @param tenantId owning tenant, or null for platform-wide secrets.
     * @return the value, or empty when no store holds it.
     * @throws EnvironmentPolicyViolationException in production when the type has no policy.
     * @throws StoreUnavailableException           in production when the hardened store fails.
     */
    public Optional<String> getSecret(SecretType type, String path, String key, @Nullable String tenantId) {
        SecretAddress address = new SecretAddress(type, path, key, tenantId);
        Optional<SecretPolicy> policyOpt = resolvePolicy(type);
        if (policyOpt.isEmpty()) {
            audit("read", "failure", address, Map.of("reason", "no_policy"));
            return Optional.empty();
        }
        SecretPolicy policy = policyOpt.get();

        if (hardenedStore != null) {
            try {
                Optional<String> value = hardenedStore.get(address.storagePath(), address.key(), storeTimeout);
                if (value.isPresent()) {
                    log.debug("Secret {} resolved from hardened store", address.describe());
                    audit("read", "success", address, Map.of("store", "hardened"));
                    return value;
                }
            } catch (StorageException e) {
                if (environment.isProduction()) {
                    log.error("Hardened store unavailable while reading {}: {}", address.describe(), e.getMessage());
                    audit("read", "failure", address, Map.of("reason", "store_unavailable"));
                    throw new StoreUnavailableException("Hardened secret store unavailable while reading " + address.describe(), e);
                }
                log.warn("Hardened store failed while reading {} in {}; trying fallback if allowed: {}",
                        address.describe(), environment, e.getMessage());
            }
        }

        if (fallbackStore != null && !environment.isProduction() && policy.allowsLocalFallbackInDev()) {
            Optional<String> value = readFallback(address);
            if (value.isPresent()) {
                log.warn("Secret {} served from environment variable {} in {}. Store it in the hardened store before "
                                + "promoting to production.",
                        address.describe(), LocalFallbackStore.variableName(address.storagePath(), address.key()), environment);
                audit("read", "success", address, Map.of("store", "fallback"));
                return value;
            }
        }

        log.debug("Secret {} not found", address.describe());
        audit("read", "not_found", address, null);
        return Optional.empty();
    }

    /**
     * Writes a secret to the hardened store after validating it against the type's policy.
     *
     * @return true when stored; false outside production when no hardened store is available.
     * @throws ValueValidationException            when the value fails length or complexity rules.
     * @throws EnvironmentPolicyViolationException in production when the type has no policy or no hardened store exists.
     * @throws StoreUnavailableException           in production when the write fails.
     */
    public boolean putSecret(SecretType type, String path, String key, String value, @Nullable String tenantId) {
        SecretAddress address = new SecretAddress(type, path, key, tenantId);
        Optional<SecretPolicy> policyOpt = resolvePolicy(type);
        if (policyOpt.isEmpty()) {
            audit("write", "failure", address, Map.of("reason", "no_policy"));
            return false;
        }

        String violation = policyOpt.get().describeViolation(value);
        if (violation != null) {
            log.warn("Rejected value for {}: {}", address.describe(), violation);
            audit("write", "failure", address, Map.of("reason", "validation"));
            throw new ValueValidationException(type, violation);
        }

        if (!requireHardenedStoreForWrite(address, "write")) {
            return false;
        }
        try {
            hardenedStore.put(address.storagePath(), address.key(), value, storeTimeout);
        } catch (StorageException e) {
            return handleWriteFailure(address, "write", e);
        }
        log.info("Stored secret {}", address.describe());
        audit("write", "success", address, null);
        return true;
    }

    /**
     * Generates a fresh value for the secret and stores it. The previous value is never read.
     */
    public RotationResult rotateSecret(SecretType type, String path, String key, @Nullable String tenantId) {
        SecretAddress address = new SecretAddress(type, path, key, tenantId);
        Optional<SecretPolicy> policyOpt = resolvePolicy(type);
        if (policyOpt.isEmpty()) {
            audit("rotate", "failure", address, Map.of("reason", "no_policy"));
            return new RotationResult(address, clock.instant(), false);
        }
        String newValue = valueGenerator.generate(type, policyOpt.get());
        boolean stored = putSecret(type, path, key, newValue, tenantId);
        if (stored) {
            log.info("Rotated secret {}", address.describe());
        } else {
            log.warn("Rotation of secret {} was not stored", address.describe());
        }
        audit("rotate", stored ? "success" : "failure", address, null);
        return new RotationResult(address, clock.instant(), stored);
    }

    /**
     * Removes a secret from the hardened store.
     *
     * @return true when the delete reached the store; false outside production without a hardened store.
     */
    public boolean deleteSecret(SecretType type, String path, String key, @Nullable String tenantId) {
        SecretAddress address = new SecretAddress(type, path, key, tenantId);
        if (!requireHardenedStoreForWrite(address, "delete")) {
            return false;
        }
        try {
            hardenedStore.delete(address.storagePath(), address.key(), storeTimeout);
        } catch (StorageException e) {
            return handleWriteFailure(address, "delete", e);
        }
        log.info("Deleted secret {}", address.describe());
        audit("delete", "success", address, null);
        return true;
    }

    /**
     * Lists the keys stored at a path in the hardened store.
     *
     * @return key names, empty outside production when no hardened store is configured or it fails.
     */
    public List<String> listSecretKeys(SecretType type, String path, @Nullable String tenantId) {
        // The key is a placeholder; only the path is used.
        SecretAddress address = new SecretAddress(type, path, "list", tenantId);
        if (hardenedStore == null) {
            return List.of();
        }
        try {
            return hardenedStore.list(address.storagePath(), storeTimeout);
        } catch (StorageException e) {
            if (environment.isProduction()) {
                throw new StoreUnavailableException("Hardened secret store unavailable while listing " + address.storagePath(), e);
            }
            log.warn("Hardened store failed while listing {}: {}", address.storagePath(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Checks current storage state against the environment's rules. Never throws for store failures;
     * an unreachable store is reported as unhealthy.
     */
    public ComplianceSnapshot validateEnvironmentCompliance() {
        List<String> violations = new ArrayList<>();
        StoreHealth hardenedHealth = null;

        if (hardenedStore == null) {
            if (environment.isProduction()) {
                violations.add("No hardened secret store configured in production");
            }
        } else {
            hardenedHealth = probe(hardenedStore);
            if (!hardenedHealth.healthy()) {
                violations.add("Hardened secret store is unhealthy: " + hardenedHealth.detail());
            }
        }

        boolean fallbackActive = fallbackStore != null;
        if (fallbackActive && environment.isProduction()) {
            violations.add("Environment-variable fallback store is active in production");
        }

        if (!violations.isEmpty()) {
            log.warn("Secrets compliance check for {} found {} violation(s): {}", environment, violations.size(), violations);
        } else {
            log.debug("Secrets compliance check for {} passed", environment);
        }
        return new ComplianceSnapshot(environment, violations.isEmpty(), violations, hardenedHealth, fallbackActive);
    }

    public boolean hasHardenedStore() {
        return hardenedStore != null;
    }

    private Optional<SecretPolicy> resolvePolicy(SecretType type) {
        Optional<SecretPolicy> policy = policyTable.policyFor(type);
        if (policy.isEmpty()) {
            if (environment.isProduction()) {
                log.error("No secret policy configured for {} in production", type);
                throw new EnvironmentPolicyViolationException(environment, type, "No policy configured for secret type");
            }
            log.error("No secret policy configured for {}; treating as not found", type);
        }
        return policy;
    }

    private Optional<String> readFallback(SecretAddress address) {
        try {
            return fallbackStore.get(address.storagePath(), address.key(), storeTimeout);
        } catch (StorageException e) {
            log.warn("Fallback store failed while reading {}: {}", address.describe(), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean requireHardenedStoreForWrite(SecretAddress address, String action) {
        if (hardenedStore != null) {
            return true;
        }
        if (environment.isProduction()) {
            audit(action, "failure", address, Map.of("reason", "no_hardened_store"));
            throw new EnvironmentPolicyViolationException(environment, address.secretType(),
                    "Cannot " + action + " secret without a hardened store");
        }
        log.warn("Cannot {} secret {} in {}: no hardened store configured", action, address.describe(), environment);
        audit(action, "failure", address, Map.of("reason", "no_hardened_store"));
        return false;
    }

    private boolean handleWriteFailure(SecretAddress address, String action, StorageException e) {
        audit(action, "failure", address, Map.of("reason", "store_unavailable"));
        if (environment.isProduction()) {
            log.error("Hardened store unavailable during {} of {}: {}", action, address.describe(), e.getMessage());
            throw new StoreUnavailableException("Hardened secret store unavailable during " + action + " of " + address.describe(), e);
        }
        log.error("Hardened store failed during {} of {} in {}: {}", action, address.describe(), environment, e.getMessage());
        return false;
    }

    private StoreHealth probe(SecretStore store) {
        try {
            return store.health(storeTimeout);
        } catch (RuntimeException e) {
            log.warn("Secret store health probe threw: {}", e.getMessage());
            return StoreHealth.unhealthy("unknown", "health probe failed: " + e.getClass().getSimpleName());
        }
    }

    private void audit(String action, String outcome, SecretAddress address, @Nullable Map<String, Object> extra) {
        Map<String, Object> data = new HashMap<>();
        data.put("secret_type", address.secretType().name());
        data.put("path", address.storagePath());
        data.put("key", address.key());
        data.put("environment", environment.name());
        if (extra != null) {
            data.putAll(extra);
        }
        auditHelper.logInternalEvent(AUDIT_TYPE, action, outcome, null, data);
    }
}
