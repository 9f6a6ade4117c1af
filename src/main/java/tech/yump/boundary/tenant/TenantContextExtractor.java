package tech.yump.boundary.tenant;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import tech.yump.boundary.core.TenantIds;
import tech.yump.boundary.web.InboundRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads tenant id candidates from each supported request signal. Each source is checked for syntax
 * only; a value that is not a UUID or slug is treated as absent.
 */
@Slf4j
public class TenantContextExtractor {

    public static final String DEFAULT_GATEWAY_HEADER = "X-Gateway-Tenant-ID";
    public static final String DEFAULT_CONTAINER_HEADER = "X-Container-Tenant-ID";
    public static final String DEFAULT_TOKEN_CLAIM = "tenant_id";

    private final String gatewayHeader;
    private final String containerHeader;
    private final String tokenClaim;
    @Nullable
    private final String baseDomain;
    private final Set<String> reservedSubdomains;

    /**
     * @param baseDomain         domain under which tenants get subdomains; null disables subdomain extraction.
     * @param reservedSubdomains labels such as {@code www} that never name a tenant.
     */
    public TenantContextExtractor(
            String gatewayHeader,
            String containerHeader,
            String tokenClaim,
            @Nullable String baseDomain,
            Set<String> reservedSubdomains) {
        this.gatewayHeader = gatewayHeader;
        this.containerHeader = containerHeader;
        this.tokenClaim = tokenClaim;
        this.baseDomain = StringUtils.hasText(baseDomain) ? baseDomain.toLowerCase(Locale.ROOT) : null;
        this.reservedSubdomains = reservedSubdomains.stream()
                .map(label -> label.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static TenantContextExtractor withDefaults(@Nullable String baseDomain) {
        return new TenantContextExtractor(DEFAULT_GATEWAY_HEADER, DEFAULT_CONTAINER_HEADER, DEFAULT_TOKEN_CLAIM,
                baseDomain, Set.of("www", "api", "admin", "app"));
    }

    /**
     * All candidates present on the request, in priority order.
     */
    public List<TenantContext> extractAll(InboundRequest request) {
        List<TenantContext> candidates = new ArrayList<>(TenantSource.values().length);
        fromGatewayHeader(request).ifPresent(candidates::add);
        fromContainerContext(request).ifPresent(candidates::add);
        fromAuthToken(request).ifPresent(candidates::add);
        fromSubdomain(request).ifPresent(candidates::add);
        return candidates;
    }

    public Optional<TenantContext> fromGatewayHeader(InboundRequest request) {
        return request.header(gatewayHeader)
                .flatMap(value -> candidate(value.trim(), TenantSource.GATEWAY_HEADER));
    }

    /**
     * The trimmed gateway header as sent, without the syntax check applied to candidates. Blank counts as absent.
     */
    public Optional<String> gatewayHeaderValue(InboundRequest request) {
        return request.header(gatewayHeader)
                .map(String::trim)
                .filter(StringUtils::hasText);
    }

    public Optional<TenantContext> fromContainerContext(InboundRequest request) {
        return request.header(containerHeader)
                .flatMap(value -> candidate(value.trim(), TenantSource.CONTAINER_CONTEXT));
    }

    public Optional<TenantContext> fromAuthToken(InboundRequest request) {
        Object claim = request.authClaims().get(tokenClaim);
        if (claim == null) {
            return Optional.empty();
        }
        if (!(claim instanceof String value)) {
            log.warn("Ignoring non-string '{}' claim of type {}", tokenClaim, claim.getClass().getSimpleName());
            return Optional.empty();
        }
        return candidate(value, TenantSource.AUTH_TOKEN);
    }

    public Optional<TenantContext> fromSubdomain(InboundRequest request) {
        if (baseDomain == null) {
            return Optional.empty();
        }
        String host = request.host();
        String suffix = "." + baseDomain;
        if (host == null || !host.endsWith(suffix) || host.length() == suffix.length()) {
            return Optional.empty();
        }
        String label = host.substring(0, host.length() - suffix.length());
        if (label.contains(".") || reservedSubdomains.contains(label)) {
            log.trace("Host '{}' does not carry a tenant subdomain", host);
            return Optional.empty();
        }
        return candidate(label, TenantSource.SUBDOMAIN);
    }

    private Optional<TenantContext> candidate(String value, TenantSource source) {
        if (!TenantIds.isValid(value)) {
            log.warn("Ignoring malformed tenant id from {}", source);
            return Optional.empty();
        }
        return Optional.of(TenantContext.candidate(value, source));
    }
}
