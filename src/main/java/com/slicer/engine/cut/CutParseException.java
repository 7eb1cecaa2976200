package com.slicer.engine.cut;

import com.slicer.engine.EngineException;

public class CutParseException extends EngineException {

    public CutParseException(String message) {
        super("argument", message);
    }
}
