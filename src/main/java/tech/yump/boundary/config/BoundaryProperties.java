package tech.yump.boundary.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.boundary.compliance.PlatformPosture;
import tech.yump.boundary.compliance.PortalType;
import tech.yump.boundary.compliance.Severity;
import tech.yump.boundary.config.validation.ValidCsrfConfig;
import tech.yump.boundary.core.Environment;
import tech.yump.boundary.core.TenantIds;
import tech.yump.boundary.csrf.CookieAttributes;
import tech.yump.boundary.csrf.CsrfMode;
import tech.yump.boundary.csrf.CsrfPolicy;
import tech.yump.boundary.csrf.CsrfTokenCodec;
import tech.yump.boundary.csrf.TokenDelivery;
import tech.yump.boundary.secrets.SecretPolicy;
import tech.yump.boundary.secrets.SecretPolicyTable;
import tech.yump.boundary.secrets.SecretType;
import tech.yump.boundary.tenant.TenantContextExtractor;
import tech.yump.boundary.tenant.TenantRecord;
import tech.yump.boundary.tenant.TenantStatus;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the trust boundary under the 'boundary' prefix.
 */
@ConfigurationProperties(prefix = "boundary")
@Validated
public record BoundaryProperties(

        @NotNull(message = "Deployment environment (boundary.environment) is required.")
        Environment environment,

        @Valid
        SecretsProperties secrets,

        @Valid
        TenantProperties tenant,

        @Valid
        CsrfProperties csrf,

        @Valid
        PostureProperties posture,

        @Valid
        ComplianceProperties compliance,

        @Valid
        AuditProperties audit
) {
    public BoundaryProperties {
        secrets = secrets != null ? secrets : new SecretsProperties(null, null, null);
        tenant = tenant != null ? tenant : new TenantProperties(null, null, null, null, null, null, null);
        csrf = csrf != null ? csrf : new CsrfProperties(null, null, null, null, null, null, null, null);
        posture = posture != null ? posture : new PostureProperties(null, false, false, false, false, null, false, false, false, null);
        compliance = compliance != null ? compliance : new ComplianceProperties(null, null, null);
        audit = audit != null ? audit : new AuditProperties(null, null);
    }

    // --- Secrets ---
    @Validated
    public record SecretsProperties(
            @Valid
            HardenedStoreProperties hardenedStore,

            Duration timeout,

            @Valid
            Map<SecretType, PolicyOverride> policies
    ) {
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

        public SecretsProperties {
            hardenedStore = hardenedStore != null ? hardenedStore : new HardenedStoreProperties(false, null, null, null);
            timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
            policies = policies != null ? Map.copyOf(policies) : Map.of();
        }

        @AssertTrue(message = "Secret store timeout (boundary.secrets.timeout) must be positive.")
        public boolean isTimeoutPositive() {
            return !timeout.isNegative() && !timeout.isZero();
        }

        /**
         * Default policy table with the configured per-type overrides applied.
         */
        public SecretPolicyTable toPolicyTable() {
            SecretPolicyTable defaults = SecretPolicyTable.defaults();
            Map<SecretType, SecretPolicy> overridden = new EnumMap<>(SecretType.class);
            policies.forEach((type, override) -> overridden.put(type,
                    override.applyTo(defaults.policyFor(type).orElseThrow())));
            return SecretPolicyTable.withOverrides(overridden);
        }
    }

    @Validated
    public record HardenedStoreProperties(
            boolean enabled,
            URI url,
            String token,
            Duration connectTimeout
    ) {
        public HardenedStoreProperties {
            connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(2);
        }

        @AssertTrue(message = "Hardened store URL and token (boundary.secrets.hardened-store.url/token) must be provided when the store is enabled.")
        public boolean isConnectionConfigured() {
            return !enabled || (url != null && StringUtils.hasText(token));
        }

        @Override
        public String toString() {
            // Never log the store token
            return "HardenedStoreProperties[" +
                    "enabled=" + enabled +
                    ", url=" + url +
                    ", token=" + (token != null ? "******" : "null") +
                    ", connectTimeout=" + connectTimeout +
                    ']';
        }
    }

    /**
     * Partial override of a default {@link SecretPolicy}; unset fields keep the default.
     */
    public record PolicyOverride(
            Boolean requiresHardenedStoreInProduction,
            Boolean allowsLocalFallbackInDev,
            Integer rotationIntervalDays,
            Integer minLength,
            Boolean complexityRequired,
            Integer generatedLength
    ) {
        public SecretPolicy applyTo(SecretPolicy base) {
            return new SecretPolicy(
                    requiresHardenedStoreInProduction != null ? requiresHardenedStoreInProduction : base.requiresHardenedStoreInProduction(),
                    allowsLocalFallbackInDev != null ? allowsLocalFallbackInDev : base.allowsLocalFallbackInDev(),
                    rotationIntervalDays != null ? rotationIntervalDays : base.rotationIntervalDays(),
                    minLength != null ? minLength : base.minLength(),
                    complexityRequired != null ? complexityRequired : base.complexityRequired(),
                    generatedLength != null ? generatedLength : base.generatedLength());
        }
    }

    // --- Tenant boundary ---
    @Validated
    public record TenantProperties(
            List<String> exemptPaths,
            String gatewayHeader,
            String containerHeader,
            String tokenClaim,
            String baseDomain,
            Set<String> reservedSubdomains,
            @Valid
            List<TenantEntry> registry
    ) {
        public TenantProperties {
            exemptPaths = exemptPaths != null ? List.copyOf(exemptPaths) : List.of("/sys/", "/actuator/", "/v3/api-docs", "/swagger-ui/");
            gatewayHeader = StringUtils.hasText(gatewayHeader) ? gatewayHeader : TenantContextExtractor.DEFAULT_GATEWAY_HEADER;
            containerHeader = StringUtils.hasText(containerHeader) ? containerHeader : TenantContextExtractor.DEFAULT_CONTAINER_HEADER;
            tokenClaim = StringUtils.hasText(tokenClaim) ? tokenClaim : TenantContextExtractor.DEFAULT_TOKEN_CLAIM;
            baseDomain = StringUtils.hasText(baseDomain) ? baseDomain : null;
            reservedSubdomains = reservedSubdomains != null ? Set.copyOf(reservedSubdomains) : Set.of("www", "api", "admin", "app");
            registry = registry != null ? List.copyOf(registry) : List.of();
        }

        public List<TenantRecord> registryRecords() {
            return registry.stream().map(entry -> new TenantRecord(entry.id(), entry.status())).toList();
        }
    }

    @Validated
    public record TenantEntry(
            @NotBlank(message = "Tenant id (boundary.tenant.registry[].id) must be provided.")
            String id,
            TenantStatus status
    ) {
        public TenantEntry {
            status = status != null ? status : TenantStatus.ACTIVE;
        }

        @AssertTrue(message = "Tenant id must be a UUID or a lower-case slug.")
        public boolean isIdWellFormed() {
            return id == null || TenantIds.isValid(id);
        }
    }

    // --- CSRF ---
    @Validated
    @ValidCsrfConfig
    public record CsrfProperties(
            CsrfMode mode,
            TokenDelivery delivery,
            Boolean requireRefererCheck,
            List<String> allowedOrigins,
            Duration tokenLifetime,
            List<String> apiPathPrefixes,
            List<String> ssrPathPrefixes,
            CookieProperties cookie
    ) {
        public CsrfProperties {
            mode = mode != null ? mode : CsrfMode.HYBRID;
            delivery = delivery != null ? delivery : TokenDelivery.BOTH;
            requireRefererCheck = requireRefererCheck != null ? requireRefererCheck : Boolean.TRUE;
            allowedOrigins = allowedOrigins != null ? List.copyOf(allowedOrigins) : List.of();
            tokenLifetime = tokenLifetime != null ? tokenLifetime : CsrfTokenCodec.DEFAULT_LIFETIME;
            apiPathPrefixes = apiPathPrefixes != null ? List.copyOf(apiPathPrefixes) : List.of("/api/");
            ssrPathPrefixes = ssrPathPrefixes != null ? List.copyOf(ssrPathPrefixes) : List.of("/portal/");
            cookie = cookie != null ? cookie : new CookieProperties(null, null, null, null);
        }

        public CsrfPolicy toPolicy() {
            return new CsrfPolicy(mode, delivery, requireRefererCheck, allowedOrigins,
                    new CookieAttributes(cookie.secure(), cookie.httpOnly(), cookie.sameSite(), cookie.path()),
                    tokenLifetime, apiPathPrefixes, ssrPathPrefixes);
        }
    }

    public record CookieProperties(Boolean secure, Boolean httpOnly, String sameSite, String path) {
        public CookieProperties {
            CookieAttributes defaults = CookieAttributes.defaults();
            secure = secure != null ? secure : defaults.secure();
            httpOnly = httpOnly != null ? httpOnly : defaults.httpOnly();
            sameSite = StringUtils.hasText(sameSite) ? sameSite : defaults.sameSite();
            path = StringUtils.hasText(path) ? path : defaults.path();
        }
    }

    // --- Platform posture ---

    /**
     * Observed platform settings fed to the compliance auditor.
     *
     * @param declaredEnvironment     value of the deployment's {@code ENVIRONMENT} variable.
     * @param contentSecurityPolicy   CSP header value; blank disables the header.
     */
    public record PostureProperties(
            String declaredEnvironment,
            boolean debug,
            boolean httpsOnly,
            boolean securityHeaders,
            boolean hsts,
            String contentSecurityPolicy,
            boolean rateLimiting,
            boolean strictRateLimits,
            boolean tlsEnabled,
            String tlsMinVersion
    ) {
        public PostureProperties {
            declaredEnvironment = declaredEnvironment != null ? declaredEnvironment.trim() : "";
            contentSecurityPolicy = contentSecurityPolicy != null ? contentSecurityPolicy.trim() : "";
            tlsMinVersion = StringUtils.hasText(tlsMinVersion) ? tlsMinVersion : "1.2";
        }

        public boolean cspEnabled() {
            return securityHeaders && !contentSecurityPolicy.isEmpty();
        }

        public PlatformPosture toPosture(boolean auditLoggingEnabled) {
            return PlatformPosture.builder()
                    .declaredEnvironment(declaredEnvironment)
                    .debugEnabled(debug)
                    .httpsOnly(httpsOnly)
                    .securityHeadersEnabled(securityHeaders)
                    .hstsEnabled(securityHeaders && hsts)
                    .cspEnabled(cspEnabled())
                    .rateLimitingEnabled(rateLimiting)
                    .strictRateLimits(strictRateLimits)
                    .tlsEnabled(tlsEnabled)
                    .tlsMinVersion(tlsMinVersion)
                    .auditLoggingEnabled(auditLoggingEnabled)
                    .build();
        }
    }

    // --- Compliance ---
    @Validated
    public record ComplianceProperties(
            Map<Severity, Double> severityWeights,
            Map<PortalType, Map<String, PlatformPosture.AdditionalCheck>> portals,
            Boolean auditOnStartup
    ) {
        public ComplianceProperties {
            severityWeights = severityWeights != null ? Map.copyOf(severityWeights) : Map.of();
            portals = portals != null ? Map.copyOf(portals) : Map.of();
            auditOnStartup = auditOnStartup != null ? auditOnStartup : Boolean.TRUE;
        }

        @AssertTrue(message = "Severity weights (boundary.compliance.severity-weights) must not be negative.")
        public boolean isSeverityWeightsValid() {
            return severityWeights.values().stream().allMatch(weight -> weight != null && weight >= 0);
        }

        public Map<PortalType, Map<String, PlatformPosture.AdditionalCheck>> portalChecks() {
            return portals;
        }
    }

    // --- Audit ---
    public record AuditProperties(String backend, FileAuditProperties file) {
        public static final String BACKEND_PROPERTY = "boundary.audit.backend";

        public AuditProperties {
            backend = StringUtils.hasText(backend) ? backend : "slf4j";
            file = file != null ? file : new FileAuditProperties(null);
        }

        @AssertTrue(message = "Audit backend (boundary.audit.backend) must be 'slf4j' or 'file'.")
        public boolean isBackendKnown() {
            return "slf4j".equals(backend) || "file".equals(backend);
        }

        /**
         * Read by logback-spring.xml; the application itself only logs to the audit logger.
         */
        public record FileAuditProperties(String path) {
            public static final String PATH_PROPERTY = "boundary.audit.file.path";

            public FileAuditProperties {
                path = StringUtils.hasText(path) ? path : "logs/audit.log";
            }
        }
    }
}
