package com.slicer.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of the errors the slicer classifies itself. Each carries the error
 * kind reported to clients and the HTTP status it maps to.
 */
public abstract class SlicerException extends RuntimeException {

    protected SlicerException(String message) {
        super(message);
    }

    protected SlicerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorKind();

    public abstract HttpStatus getStatus();
}
