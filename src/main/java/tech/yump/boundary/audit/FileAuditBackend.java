package tech.yump.boundary.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as bare JSON lines to the dedicated {@value #AUDIT_LOGGER_NAME} logger, which
 * {@code logback-spring.xml} routes to its own file appender.
 */
@Slf4j
@RequiredArgsConstructor
public class FileAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER_NAME = "tech.yump.boundary.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }
        try {
            auditLogger.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            // Errors go to the application log so the audit file stays valid JSON lines.
            log.error("Failed to serialize audit event {}/{} for the audit file.", event.type(), event.action(), e);
        }
    }
}
