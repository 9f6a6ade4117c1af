package tech.yump.boundary.secrets;

import tech.yump.boundary.core.TenantIds;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Location of one secret: its type, logical path, key and optional owning tenant.
 * <p>
 * Tenant-scoped secrets always resolve under {@code tenants/{tenantId}/}, so one tenant's address can
 * never point into another tenant's namespace. Paths are relative, slash-separated and restricted to
 * {@code [A-Za-z0-9._-]} segments; {@code .} and {@code ..} segments are rejected.
 */
public record SecretAddress(SecretType secretType, String path, String key, String tenantId) {

    public static final String TENANT_ROOT = "tenants";

    private static final Pattern SEGMENT = Pattern.compile("^[A-Za-z0-9._-]+$");

    public SecretAddress {
        if (secretType == null) {
            throw new IllegalArgumentException("Secret type must not be null");
        }
        requireValidPath(path);
        if (key == null || !SEGMENT.matcher(key).matches() || isDotSegment(key)) {
            throw new IllegalArgumentException("Invalid secret key: '" + key + "'");
        }
        if (tenantId != null && !TenantIds.isValid(tenantId)) {
            throw new IllegalArgumentException("Invalid tenant id: '" + tenantId + "'");
        }
    }

    public static SecretAddress of(SecretType secretType, String path, String key) {
        return new SecretAddress(secretType, path, key, null);
    }

    public static SecretAddress forTenant(SecretType secretType, String path, String key, String tenantId) {
        return new SecretAddress(secretType, path, key, tenantId);
    }

    public Optional<String> tenant() {
        return Optional.ofNullable(tenantId);
    }

    /**
     * The path handed to the store: {@code tenants/{tenantId}/{path}} for tenant-scoped secrets,
     * {@code path} otherwise.
     */
    public String storagePath() {
        return tenantId == null ? path : TENANT_ROOT + "/" + tenantId + "/" + path;
    }

    /**
     * Rendering for logs and audit records. Contains no secret material.
     */
    public String describe() {
        return secretType + ":" + storagePath() + "#" + key;
    }

    private static void requireValidPath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Secret path must not be empty");
        }
        if (path.startsWith("/") || path.endsWith("/")) {
            throw new IllegalArgumentException("Secret path must not start or end with '/': '" + path + "'");
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || isDotSegment(segment) || !SEGMENT.matcher(segment).matches()) {
                throw new IllegalArgumentException("Invalid secret path: '" + path + "'");
            }
        }
    }

    private static boolean isDotSegment(String segment) {
        return ".".equals(segment) || "..".equals(segment);
    }
}
