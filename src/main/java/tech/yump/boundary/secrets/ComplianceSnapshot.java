package tech.yump.boundary.secrets;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.yump.boundary.core.Environment;
import tech.yump.boundary.storage.StoreHealth;

import java.util.List;

/**
 * Point-in-time view of whether secret storage satisfies the environment's rules.
 *
 * @param hardenedStoreHealth null when no hardened store is configured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComplianceSnapshot(
        Environment environment,
        boolean compliant,
        List<String> violations,
        StoreHealth hardenedStoreHealth,
        boolean fallbackStoreActive
) {
    public ComplianceSnapshot {
        violations = List.copyOf(violations);
    }
}
