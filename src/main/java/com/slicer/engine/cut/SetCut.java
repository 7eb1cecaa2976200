package com.slicer.engine.cut;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Cut to any of several paths, for example {@code geo:us;ca}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class SetCut extends Cut {

    private final List<List<String>> paths;

    public SetCut(String dimension, String hierarchy, List<List<String>> paths, boolean invert) {
        super(dimension, hierarchy, invert);
        this.paths = paths.stream().map(List::copyOf).toList();
    }
}
