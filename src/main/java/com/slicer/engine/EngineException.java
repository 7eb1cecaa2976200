package com.slicer.engine;

/**
 * Error raised by the aggregation engine. The error type is the engine's own
 * classification and is reported to clients unchanged.
 */
public class EngineException extends RuntimeException {

    private final String errorType;

    public EngineException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public EngineException(String errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
