package com.slicer.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * The server is configured for a mode it does not support. Operator error,
 * never the client's.
 */
public class ServerMisconfigurationException extends SlicerException {

    public ServerMisconfigurationException(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return "internal";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
