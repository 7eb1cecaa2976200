package com.slicer.engine;

import java.util.List;
import java.util.Map;

/**
 * Result of an aggregation.
 *
 * Iterating the result yields the drilled-down records, one map per row keyed
 * by result label. Records may be produced lazily and iterated only once.
 */
public interface AggregationResult extends Iterable<Map<String, Object>>, MapRepresentable {

    /**
     * Labels of the result columns in output order.
     */
    List<String> getLabels();
}
