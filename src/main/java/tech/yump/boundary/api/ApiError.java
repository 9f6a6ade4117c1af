package tech.yump.boundary.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error body returned by the boundary filters")
public record ApiError(
        @Schema(description = "Error message. Rejections at the boundary always read 'Access denied.'.",
                example = "Access denied.", requiredMode = Schema.RequiredMode.REQUIRED)
        String message,
        @Schema(description = "Timestamp when the error occurred.", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant timestamp
) {
    public ApiError(String message) {
        this(message, Instant.now());
    }
}
