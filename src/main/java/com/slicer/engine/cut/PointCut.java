package com.slicer.engine.cut;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Cut to a single path of a dimension hierarchy, for example {@code date:2010,1}.
 * An empty path denotes the whole dimension.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class PointCut extends Cut {

    private final List<String> path;

    public PointCut(String dimension, String hierarchy, List<String> path, boolean invert) {
        super(dimension, hierarchy, invert);
        this.path = List.copyOf(path);
    }
}
