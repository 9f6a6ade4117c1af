package tech.yump.boundary.audit;

/**
 * Destination for audit events. Implementations must not throw: a failing audit sink is logged,
 * never propagated into the request being audited.
 */
public interface AuditBackend {

    /**
     * Records one audit event.
     *
     * @param event The event to record. Null events are ignored with a warning.
     */
    void logEvent(AuditEvent event);
}
