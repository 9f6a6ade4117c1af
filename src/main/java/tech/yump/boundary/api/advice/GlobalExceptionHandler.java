package tech.yump.boundary.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.boundary.audit.AuditHelper;
import tech.yump.boundary.tenant.TenantBoundaryException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    static final String ACCESS_DENIED = "Access denied.";

    private final AuditHelper auditHelper;

    // --- Boundary rejections ---

    @ExceptionHandler(TenantBoundaryException.class)
    public ResponseEntity<ProblemDetail> handleTenantBoundary(TenantBoundaryException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.FORBIDDEN;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ACCESS_DENIED);
        problemDetail.setTitle("Forbidden");
        log.warn("Tenant boundary rejected request {} {}: {} at {} ({})",
                request.getMethod(), request.getRequestURI(), ex.getReason(), ex.getStage(), ex.getMessage());

        Map<String, Object> data = extractContextData(request);
        data.put("reason", ex.getReason().name());
        data.put("stage", ex.getStage().name());
        // The internal reason stays in the audit trail; the client only sees the generic message.
        auditHelper.logHttpEvent("tenant_boundary", "enforce", "denied", status.value(), ex.getMessage(), data);
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Request validation ---

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        auditHelper.logHttpEvent("request_validation", determineActionFromRequest(request), "failure", status.value(),
                ex.getMessage(), extractContextData(request));
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        log.warn("Bad request: Malformed body received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent("request_validation", determineActionFromRequest(servletRequest), "failure",
                    status.value(), message, extractContextData(servletRequest));
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging in handleHttpMessageNotReadable.");
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent("system_error", determineActionFromRequest(request), "failure", status.value(),
                message, extractContextData(request));
        return ResponseEntity.status(status).body(problemDetail);
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.startsWith("/sys/compliance")) return "compliance_report";
        if (path.startsWith("/api/v1/tenant/verify")) return "verify_request";
        if (path.startsWith("/api/v1/tenant")) return "read_tenant";
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        data.put("path", request.getRequestURI());
        return data;
    }
}
