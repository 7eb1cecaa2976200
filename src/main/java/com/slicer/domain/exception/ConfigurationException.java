package com.slicer.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Invalid server option. Raised while the application context starts, so the
 * server never accepts requests with a bad configuration.
 */
public class ConfigurationException extends SlicerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "configuration";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
