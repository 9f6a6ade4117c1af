package tech.yump.boundary.tenant;

import lombok.extern.slf4j.Slf4j;
import tech.yump.boundary.web.InboundRequest;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Establishes the tenant for a request by reconciling every available signal.
 * <p>
 * All candidates must agree; the primary one is chosen by {@link TenantSource} priority. The tenant must
 * then be {@link TenantStatus#isAdmissible() admissible} in the registry, and when the gateway asserted a
 * tenant it must be the same one. Any failure rejects the request; registry errors fail closed.
 */
@Slf4j
public class TenantBoundaryEnforcer {

    private final TenantContextExtractor extractor;
    private final TenantRegistry registry;
    private final List<String> exemptPaths;

    /**
     * @param exemptPaths paths that skip enforcement; entries ending in {@code /} match as prefixes.
     */
    public TenantBoundaryEnforcer(TenantContextExtractor extractor, TenantRegistry registry, List<String> exemptPaths) {
        this.extractor = extractor;
        this.registry = registry;
        this.exemptPaths = List.copyOf(exemptPaths);
        log.info("TenantBoundaryEnforcer initialized with {} exempt path(s): {}", this.exemptPaths.size(), this.exemptPaths);
    }

    public boolean isExempt(String path) {
        for (String exempt : exemptPaths) {
            if (exempt.endsWith("/") ? path.startsWith(exempt) || path.equals(exempt.substring(0, exempt.length() - 1))
                    : path.equals(exempt)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Runs enforcement.
     *
     * @return the validated context, or empty when the path is exempt.
     * @throws TenantBoundaryException when the request must be refused.
     */
    public Optional<TenantContext> enforce(InboundRequest request) {
        if (isExempt(request.path())) {
            log.trace("Path {} is exempt from tenant enforcement", request.path());
            return Optional.empty();
        }

        List<TenantContext> candidates = extractor.extractAll(request);
        if (candidates.isEmpty()) {
            throw reject(TenantRejectionReason.MISSING_TENANT_CONTEXT, EnforcementStage.NO_CONTEXT,
                    "No tenant context found on request");
        }

        TenantContext primary = candidates.get(0);
        Set<String> distinctIds = candidates.stream().map(TenantContext::tenantId).collect(Collectors.toSet());
        if (distinctIds.size() > 1) {
            String detail = candidates.stream()
                    .map(c -> c.source() + "=" + c.tenantId())
                    .collect(Collectors.joining(", "));
            throw reject(TenantRejectionReason.TENANT_CONTEXT_MISMATCH, EnforcementStage.CANDIDATES_GATHERED,
                    "Tenant sources disagree: " + detail);
        }

        TenantRecord tenant;
        try {
            tenant = registry.getTenant(primary.tenantId()).orElse(null);
        } catch (RuntimeException e) {
            log.error("Tenant registry lookup failed for '{}': {}", primary.tenantId(), e.getMessage());
            throw new TenantBoundaryException(TenantRejectionReason.REGISTRY_UNAVAILABLE, EnforcementStage.RECONCILED,
                    "Tenant registry unavailable", e);
        }
        if (tenant == null || !tenant.status().isAdmissible()) {
            throw reject(TenantRejectionReason.UNKNOWN_OR_INACTIVE_TENANT, EnforcementStage.RECONCILED,
                    "Tenant '" + primary.tenantId() + "' is " + (tenant == null ? "unknown" : tenant.status()));
        }

        // Raw header: a present but malformed gateway value still has to match.
        Optional<String> gateway = extractor.gatewayHeaderValue(request);
        if (gateway.isPresent() && !gateway.get().equals(primary.tenantId())) {
            throw reject(TenantRejectionReason.TENANT_CONTEXT_MISMATCH, EnforcementStage.RECONCILED,
                    "Gateway tenant does not match resolved tenant");
        }

        TenantContext validated = primary.validated(gateway.isPresent());
        log.debug("Tenant '{}' validated from {} ({} source(s), gatewayConfirmed={})",
                validated.tenantId(), validated.source(), candidates.size(), validated.gatewayConfirmed());
        return Optional.of(validated);
    }

    private TenantBoundaryException reject(TenantRejectionReason reason, EnforcementStage stage, String message) {
        log.warn("Tenant boundary rejection {} at stage {}: {}", reason, stage, message);
        return new TenantBoundaryException(reason, stage, message);
    }
}
