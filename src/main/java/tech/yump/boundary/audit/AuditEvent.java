package tech.yump.boundary.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit record: who did what, to which tenant, and how it ended.
 * Serialized as one JSON object per event. Never holds secret values or CSRF tokens.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // "secrets", "tenant_boundary", "csrf", "compliance"
        String action,          // e.g. "read", "enforce", "validate"
        String outcome,         // "success", "failure", "denied", "not_found"
        String tenantId,        // tenant established for the request, if any
        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress,
            Map<String, Object> metadata
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive headers only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
