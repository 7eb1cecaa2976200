package com.slicer.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * The caller is known (or anonymous) but may not access the requested cube.
 */
public class NotAuthorizedException extends SlicerException {

    public NotAuthorizedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "not_authorized";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.FORBIDDEN;
    }
}
