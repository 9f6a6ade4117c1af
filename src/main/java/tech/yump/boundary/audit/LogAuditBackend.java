package tech.yump.boundary.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events as JSON lines to the application log, prefixed with {@code AUDIT_EVENT:}.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }
        try {
            log.info("AUDIT_EVENT: {}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit event {}/{} to JSON; logging summary only.", event.type(), event.action(), e);
            log.info("AUDIT_EVENT_FALLBACK: type={} action={} outcome={} tenant={}",
                    event.type(), event.action(), event.outcome(), event.tenantId());
        }
    }
}
