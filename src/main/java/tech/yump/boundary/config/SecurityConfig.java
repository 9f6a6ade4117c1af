package tech.yump.boundary.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.auth.AuthTokenClaimsFilter;
import tech.yump.boundary.auth.CsrfProtectionFilter;
import tech.yump.boundary.auth.TenantBoundaryFilter;
import tech.yump.boundary.csrf.CsrfPolicyEngine;
import tech.yump.boundary.secrets.SecretsPolicyEngine;
import tech.yump.boundary.tenant.TenantBoundaryEnforcer;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

    private final BoundaryProperties properties;
    private final SecretsPolicyEngine secretsPolicyEngine;
    private final TenantBoundaryEnforcer tenantBoundaryEnforcer;
    private final CsrfPolicyEngine csrfPolicyEngine;
    private final AuditHelper auditHelper;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        // Filters are created here rather than as beans so the servlet container does not register them twice.
        AuthTokenClaimsFilter claimsFilter = new AuthTokenClaimsFilter(secretsPolicyEngine);
        TenantBoundaryFilter tenantFilter = new TenantBoundaryFilter(tenantBoundaryEnforcer, auditHelper, objectMapper);
        CsrfProtectionFilter csrfFilter = new CsrfProtectionFilter(csrfPolicyEngine, auditHelper, objectMapper);

        // Spring's own CSRF support is replaced by CsrfProtectionFilter.
        http
                .csrf(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
                .addFilterBefore(claimsFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(tenantFilter, AuthTokenClaimsFilter.class)
                .addFilterAfter(csrfFilter, TenantBoundaryFilter.class)
                .authorizeHttpRequests(authz -> authz.anyRequest().permitAll());

        BoundaryProperties.PostureProperties posture = properties.posture();
        if (posture.securityHeaders()) {
            http.headers(headers -> {
                if (posture.hsts()) {
                    headers.httpStrictTransportSecurity(hsts -> hsts.includeSubDomains(true).maxAgeInSeconds(31_536_000));
                } else {
                    headers.httpStrictTransportSecurity(hsts -> hsts.disable());
                }
                if (posture.cspEnabled()) {
                    headers.contentSecurityPolicy(csp -> csp.policyDirectives(posture.contentSecurityPolicy()));
                }
            });
        } else {
            log.warn("Security response headers are disabled (boundary.posture.security-headers=false).");
            http.headers(AbstractHttpConfigurer::disable);
        }
        if (posture.httpsOnly()) {
            http.requiresChannel(channel -> channel.anyRequest().requiresSecure());
        }
        return http.build();
    }
}
