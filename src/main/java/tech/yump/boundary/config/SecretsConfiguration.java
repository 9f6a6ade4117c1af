package tech.yump.boundary.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.secrets.SecretPolicyTable;
import tech.yump.boundary.secrets.SecretsPolicyEngine;
import tech.yump.boundary.storage.RemoteHardenedStore;
import tech.yump.boundary.storage.SecretStore;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SecretsConfiguration {

    private final BoundaryProperties properties;

    @Bean
    public SecretPolicyTable secretPolicyTable() {
        SecretPolicyTable table = properties.secrets().toPolicyTable();
        if (!properties.secrets().policies().isEmpty()) {
            log.info("Secret policy overrides applied for types: {}", properties.secrets().policies().keySet());
        }
        return table;
    }

    @Bean
    public SecretsPolicyEngine secretsPolicyEngine(SecretPolicyTable secretPolicyTable, AuditHelper auditHelper) {
        BoundaryProperties.SecretsProperties secrets = properties.secrets();
        SecretStore hardenedStore = null;
        if (secrets.hardenedStore().enabled()) {
            log.info("Configuring hardened secret store at {}", secrets.hardenedStore().url());
            hardenedStore = new RemoteHardenedStore(secrets.hardenedStore().url(), secrets.hardenedStore().token(),
                    secrets.hardenedStore().connectTimeout());
        } else {
            log.warn("No hardened secret store configured (boundary.secrets.hardened-store.enabled=false).");
        }
        // Throws EnvironmentPolicyViolationException in production without a hardened store, failing startup.
        return new SecretsPolicyEngine(properties.environment(), hardenedStore, secretPolicyTable, System.getenv(),
                secrets.timeout(), auditHelper);
    }
}
