package tech.yump.boundary.tenant;

import lombok.Getter;

/**
 * Request refused at the tenant boundary.
 */
@Getter
public class TenantBoundaryException extends RuntimeException {

    private final TenantRejectionReason reason;
    private final EnforcementStage stage;

    public TenantBoundaryException(TenantRejectionReason reason, EnforcementStage stage, String message) {
        super(message);
        this.reason = reason;
        this.stage = stage;
    }

    public TenantBoundaryException(TenantRejectionReason reason, EnforcementStage stage, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.stage = stage;
    }
}
