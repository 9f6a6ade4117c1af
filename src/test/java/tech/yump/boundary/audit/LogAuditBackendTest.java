package tech.yump.boundary.audit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class LogAuditBackendTest {

    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LogAuditBackend.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void logEvent_shouldPrefixSerializedEvent() {
        AuditEvent event = AuditEvent.builder()
                .timestamp(Instant.parse("2024-06-01T10:00:00Z"))
                .type("secrets")
                .action("rotate")
                .outcome("success")
                .build();

        new LogAuditBackend(new ObjectMapper().findAndRegisterModules()).logEvent(event);

        assertThat(appender.list).singleElement().satisfies(entry -> assertThat(entry.getFormattedMessage())
                .startsWith("AUDIT_EVENT: {")
                .contains("\"type\":\"secrets\"")
                .contains("\"action\":\"rotate\""));
    }

    @Test
    void logEvent_whenSerializationFails_shouldFallBackToSummary() throws Exception {
        ObjectMapper failing = Mockito.mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {});

        new LogAuditBackend(failing).logEvent(AuditEvent.builder()
                .type("csrf").action("validate").outcome("denied").tenantId("acme").build());

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message)
                        .isEqualTo("AUDIT_EVENT_FALLBACK: type=csrf action=validate outcome=denied tenant=acme"));
    }
}
