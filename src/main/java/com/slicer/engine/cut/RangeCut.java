package com.slicer.engine.cut;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Cut to a range of paths, for example {@code date:2010-2012,6}. Either bound
 * may be null for an open range.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class RangeCut extends Cut {

    private final List<String> from;
    private final List<String> to;

    public RangeCut(String dimension, String hierarchy, List<String> from, List<String> to, boolean invert) {
        super(dimension, hierarchy, invert);
        this.from = from == null ? null : List.copyOf(from);
        this.to = to == null ? null : List.copyOf(to);
    }
}
