package com.slicer.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Error payload: {@code {"error": kind, "message": ..., "reason": ...}}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    String error;
    String message;

    /** Message of the underlying cause, if any. */
    String reason;
}
