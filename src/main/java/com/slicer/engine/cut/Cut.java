package com.slicer.engine.cut;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Restriction of one dimension.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class Cut {

    private final String dimension;
    private final String hierarchy;
    private final boolean invert;

    protected Cut(String dimension, String hierarchy, boolean invert) {
        this.dimension = dimension;
        this.hierarchy = hierarchy;
        this.invert = invert;
    }
}
