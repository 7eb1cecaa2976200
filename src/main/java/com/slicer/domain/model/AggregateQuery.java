package com.slicer.domain.model;

import com.slicer.engine.Cell;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregation request assembled from query parameters.
 *
 * Aggregates and drilldowns keep the order in which they were given across
 * all parameter occurrences.
 */
@Value
@Builder
public class AggregateQuery {

    Cell cell;
    List<String> aggregates;
    List<String> drilldown;

    /** Split cell, null when no split was requested. */
    Cell split;

    Integer page;
    Integer pageSize;
    List<OrderEntry> order;

    OutputFormat format;
    HeaderType header;

    /** Lower-cased output fields, null for all. */
    List<String> fields;
}
