package com.slicer.engine;

public interface Attribute {

    String getName();

    /**
     * Human readable label, may be null.
     */
    String getLabel();
}
