package tech.yump.boundary.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.boundary.audit.AuditBackend;
import tech.yump.boundary.audit.FileAuditBackend;
import tech.yump.boundary.audit.LogAuditBackend;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    @Bean
    @ConditionalOnProperty(name = BoundaryProperties.AuditProperties.BACKEND_PROPERTY, havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4J audit backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = BoundaryProperties.AuditProperties.BACKEND_PROPERTY, havingValue = "file")
    public AuditBackend fileAuditBackend() {
        log.info("Configuring file audit backend. Logback must route logger '{}' to the file at '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, BoundaryProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }
}
