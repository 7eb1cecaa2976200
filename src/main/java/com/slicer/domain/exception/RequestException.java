package com.slicer.domain.exception;

import org.springframework.http.HttpStatus;

/**
 * Invalid client input: bad parameter value, unparsable cut, malformed page.
 */
public class RequestException extends SlicerException {

    public RequestException(String message) {
        super(message);
    }

    public RequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorKind() {
        return "request";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
