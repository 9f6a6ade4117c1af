package tech.yump.boundary.audit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class FileAuditBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private ListAppender<ILoggingEvent> auditAppender;
    private ListAppender<ILoggingEvent> errorAppender;
    private Logger auditLogger;
    private Logger errorLogger;

    @BeforeEach
    void setUp() {
        auditLogger = (Logger) LoggerFactory.getLogger(FileAuditBackend.AUDIT_LOGGER_NAME);
        errorLogger = (Logger) LoggerFactory.getLogger(FileAuditBackend.class);
        auditAppender = new ListAppender<>();
        errorAppender = new ListAppender<>();
        auditAppender.start();
        errorAppender.start();
        auditLogger.addAppender(auditAppender);
        errorLogger.addAppender(errorAppender);
    }

    @AfterEach
    void tearDown() {
        auditLogger.detachAppender(auditAppender);
        errorLogger.detachAppender(errorAppender);
    }

    @Test
    @DisplayName("logEvent: writes one bare JSON line per event to the audit logger")
    void logEvent_shouldWriteJsonLineToAuditLogger() throws Exception {
        AuditEvent event = AuditEvent.builder()
                .timestamp(Instant.parse("2024-06-01T10:00:00Z"))
                .type("tenant_boundary")
                .action("enforce")
                .outcome("denied")
                .tenantId("acme")
                .data(Map.of("reason", "TENANT_CONTEXT_MISMATCH"))
                .build();

        new FileAuditBackend(objectMapper).logEvent(event);

        assertThat(auditAppender.list).hasSize(1);
        ILoggingEvent line = auditAppender.list.get(0);
        assertThat(line.getLevel()).isEqualTo(Level.INFO);
        JsonNode json = objectMapper.readTree(line.getFormattedMessage());
        assertThat(json.get("type").asText()).isEqualTo("tenant_boundary");
        assertThat(json.get("tenantId").asText()).isEqualTo("acme");
        assertThat(json.get("data").get("reason").asText()).isEqualTo("TENANT_CONTEXT_MISMATCH");
        assertThat(json.has("requestInfo")).isFalse();
    }

    @Test
    void logEvent_whenSerializationFails_shouldReportOnApplicationLoggerOnly() throws Exception {
        ObjectMapper failing = Mockito.mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {});

        new FileAuditBackend(failing).logEvent(AuditEvent.builder().type("csrf").action("validate").build());

        assertThat(auditAppender.list).isEmpty();
        assertThat(errorAppender.list).anySatisfy(entry -> assertThat(entry.getLevel()).isEqualTo(Level.ERROR));
    }

    @Test
    void logEvent_withNullEvent_shouldWarnAndWriteNothing() {
        new FileAuditBackend(objectMapper).logEvent(null);

        assertThat(auditAppender.list).isEmpty();
        assertThat(errorAppender.list).anySatisfy(entry -> assertThat(entry.getLevel()).isEqualTo(Level.WARN));
    }
}
