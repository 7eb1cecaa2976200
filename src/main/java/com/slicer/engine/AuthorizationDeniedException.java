package com.slicer.engine;

public class AuthorizationDeniedException extends EngineException {

    public AuthorizationDeniedException(String message) {
        super("unauthorized", message);
    }
}
