package tech.yump.boundary.core;

import java.util.regex.Pattern;

/**
 * Syntax rules for tenant identifiers: either a UUID or a lower-case DNS-label style slug.
 * Syntax only; whether the tenant exists is decided by the tenant registry.
 */
public final class TenantIds {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$");

    private TenantIds() {
    }

    public static boolean isValid(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        return UUID_PATTERN.matcher(candidate).matches() || SLUG_PATTERN.matcher(candidate).matches();
    }
}
