package com.slicer.api;

import com.slicer.domain.exception.SlicerException;
import com.slicer.engine.EngineException;
import com.slicer.engine.NoSuchCubeException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders classified errors as JSON error payloads.
 *
 * Slicer errors carry their own kind and status. Engine errors keep the
 * engine's error type: an unknown cube is 404, anything else the engine
 * reports is treated as a client error.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class SlicerExceptionHandler {

    private final MeterRegistry meterRegistry;

    @ExceptionHandler(SlicerException.class)
    public ResponseEntity<ErrorResponse> handleSlicerException(SlicerException e) {
        return respond(e.getStatus(), e.getErrorKind(), e);
    }

    @ExceptionHandler(NoSuchCubeException.class)
    public ResponseEntity<ErrorResponse> handleNoSuchCube(NoSuchCubeException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorType(), e);
    }

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineException(EngineException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorType(), e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String kind, Exception e) {
        if (status.is5xxServerError()) {
            log.error("Request failed ({}): {}", kind, e.getMessage(), e);
        } else {
            log.warn("Request rejected ({}): {}", kind, e.getMessage());
        }

        Counter.builder("slicer.request.errors")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();

        ErrorResponse body = ErrorResponse.builder()
                .error(kind)
                .message(e.getMessage())
                .reason(e.getCause() != null ? e.getCause().getMessage() : null)
                .build();

        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
