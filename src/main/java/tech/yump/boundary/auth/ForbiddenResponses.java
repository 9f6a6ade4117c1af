package tech.yump.boundary.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import tech.yump.boundary.api.ApiError;

import java.io.IOException;

/**
 * Writes the generic 403 body used by every boundary filter. The specific rejection reason is never
 * sent to the client.
 */
final class ForbiddenResponses {

    static final String ACCESS_DENIED = "Access denied.";

    private ForbiddenResponses() {
    }

    static void write(HttpServletResponse response, ObjectMapper objectMapper) throws IOException {
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(new ApiError(ACCESS_DENIED)));
    }
}
