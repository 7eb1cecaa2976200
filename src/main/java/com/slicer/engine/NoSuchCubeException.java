package com.slicer.engine;

public class NoSuchCubeException extends EngineException {

    private final String cubeName;

    public NoSuchCubeException(String cubeName) {
        super("unknown_cube", "Unknown cube '" + cubeName + "'");
        this.cubeName = cubeName;
    }

    public String getCubeName() {
        return cubeName;
    }
}
